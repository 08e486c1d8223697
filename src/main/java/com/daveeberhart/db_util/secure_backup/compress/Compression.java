package com.daveeberhart.db_util.secure_backup.compress;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.zip.GZIPInputStream;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.UnsupportedOptionsException;
import org.tukaani.xz.XZ;
import org.tukaani.xz.XZInputStream;
import org.tukaani.xz.XZOutputStream;

import com.daveeberhart.db_util.secure_backup.progress.ProgressReporter;

/**
 * Streaming compression of database dumps.
 * <p>
 * New dumps are written as XZ.  Reading also accepts gzip, which older backups were compressed
 * with; the format is detected from the stream's magic bytes.
 */
public class Compression {
  private static final Logger log = LoggerFactory.getLogger(Compression.class);

  private static final int BUFFER_SIZE = 64 * 1024;
  private static final byte[] GZIP_MAGIC = { (byte) 0x1f, (byte) 0x8b };

  private final LZMA2Options options;

  public Compression() {
    this(LZMA2Options.PRESET_DEFAULT);
  }

  public Compression(int p_preset) {
    LZMA2Options opts;
    try {
      opts = new LZMA2Options(p_preset);
    } catch (UnsupportedOptionsException e) {
      log.warn("XZ library does not support compression preset {}; using the default", p_preset);
      opts = new LZMA2Options();
    }
    options = opts;
  }

  public void compress(Path p_in, Path p_out) throws IOException {
    ProgressReporter progress = new ProgressReporter(p_in.getFileName().toString(), "Compress", Files.size(p_in));
    try (InputStream fin = Files.newInputStream(p_in);
         OutputStream xzout = new XZOutputStream(new BufferedOutputStream(Files.newOutputStream(p_out)), options, XZ.CHECK_SHA256)) {
      copy(fin, xzout, progress);
    }
    progress.done();
    log.info("Compressed {}: {} -> {} bytes", p_in.getFileName(), Files.size(p_in), Files.size(p_out));
  }

  public void decompress(Path p_in, Path p_out) throws IOException {
    try (InputStream in = openDecompressing(Files.newInputStream(p_in));
         OutputStream fout = new BufferedOutputStream(Files.newOutputStream(p_out))) {
      copy(in, fout, new ProgressReporter(p_in.getFileName().toString(), "Decompress", Files.size(p_in)));
    }
    log.info("Decompressed {}: {} -> {} bytes", p_in.getFileName(), Files.size(p_in), Files.size(p_out));
  }

  /**
   * Wrap a compressed stream in the matching decompressor.
   *
   * @throws IOException if the data is neither XZ nor gzip
   */
  public InputStream openDecompressing(InputStream p_in) throws IOException {
    BufferedInputStream in = new BufferedInputStream(p_in);
    in.mark(XZ.HEADER_MAGIC.length);
    byte[] magic = new byte[XZ.HEADER_MAGIC.length];
    int len = IOUtils.read(in, magic);
    in.reset();

    if (len == XZ.HEADER_MAGIC.length && Arrays.equals(magic, XZ.HEADER_MAGIC)) {
      return new XZInputStream(in);
    }
    if (len >= GZIP_MAGIC.length && magic[0] == GZIP_MAGIC[0] && magic[1] == GZIP_MAGIC[1]) {
      return new GZIPInputStream(in, BUFFER_SIZE);
    }
    in.close();
    throw new IOException("Data is neither XZ nor gzip compressed");
  }

  private static void copy(InputStream p_in, OutputStream p_out, ProgressReporter p_progress) throws IOException {
    byte[] buff = new byte[BUFFER_SIZE];
    int len;
    while ((len = p_in.read(buff)) >= 0) {
      p_out.write(buff, 0, len);
      p_progress.addBytesProcessed(len);
    }
  }

}
