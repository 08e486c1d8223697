package com.daveeberhart.db_util.secure_backup.notify;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.mime.MultipartEntityBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.db_util.secure_backup.config.BackupConfig;

/**
 * Sends backup outcomes to an operator through the Telegram Bot API.
 * <p>
 * On success the encrypted artifact itself is attached (when enabled and small enough for the
 * Bot API); on failure the stack trace is attached as a {@code .log} file.
 */
public class TelegramNotifier extends AbstractNotifier implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

  public static final String DEFAULT_API_BASE = "https://api.telegram.org";
  /** Bots may not upload files larger than 50MB. */
  static final long MAX_UPLOAD_BYTES = 50L * 1024 * 1024;
  private static final int MAX_ERROR_CHARS = 500;
  private static final int TIMEOUT_MILLIS = 30_000;

  private final String apiBase;
  private final String botToken;
  private final String chatId;
  private final boolean sendBackupFile;
  private final CloseableHttpClient http;

  public TelegramNotifier(String p_apiBase, String p_botToken, String p_chatId, boolean p_sendBackupFile) {
    apiBase = p_apiBase;
    botToken = p_botToken;
    chatId = p_chatId;
    sendBackupFile = p_sendBackupFile;
    http = HttpClients.custom()
        .setDefaultRequestConfig(RequestConfig.custom()
            .setConnectTimeout(TIMEOUT_MILLIS)
            .setSocketTimeout(TIMEOUT_MILLIS)
            .build())
        .build();
  }

  /**
   * @return a Telegram notifier if a bot token and chat are configured, otherwise a log-only one
   */
  public static Notifier fromConfig(BackupConfig p_config) {
    String token = p_config.get(BackupConfig.TELEGRAM_BOT_TOKEN);
    String chat = p_config.get(BackupConfig.TELEGRAM_CHAT_ID);
    if (token == null || chat == null) {
      log.warn("No Telegram bot token/chat configured; backup notifications will only be logged");
      return new LoggingNotifier();
    }
    return new TelegramNotifier(DEFAULT_API_BASE, token, chat, p_config.getBoolean(BackupConfig.SEND_BACKUP_FILE, true));
  }

  @Override
  protected void sendSuccess(String p_key, Path p_artifact, long p_size) throws IOException {
    String caption = "Database backup created\n\n"
        + p_key + "\n"
        + String.format("Size: %.1f KB%n%n", p_size / 1024d)
        + "The file is encrypted with AES-256-GCM.";

    if (sendBackupFile && p_size <= MAX_UPLOAD_BYTES) {
      sendDocument(p_artifact, p_key, caption);
    } else {
      if (sendBackupFile) {
        log.info("{} is too large for the Bot API ({} bytes); sending a text notice only", p_key, p_size);
      }
      sendMessage(caption);
    }
    log.info("Backup notification sent to chat {}: {}", chatId, p_key);
  }

  @Override
  protected void sendFailure(String p_error, String p_trace) throws IOException {
    String error = p_error == null ? "(no message)" : p_error;
    String caption = "Backup FAILED\n\n" + (error.length() > MAX_ERROR_CHARS ? error.substring(0, MAX_ERROR_CHARS) : error);
    if (p_trace == null || p_trace.isEmpty()) {
      sendMessage(caption);
      return;
    }

    String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
    Path logFile = Files.createTempFile("backup_error_" + timestamp + "_", ".log");
    try {
      String body = "Backup Error Log\n"
          + "================\n"
          + "Timestamp: " + LocalDateTime.now() + "\n"
          + "Error: " + error + "\n\n"
          + "Full stack trace:\n"
          + p_trace + "\n";
      Files.write(logFile, body.getBytes(StandardCharsets.UTF_8));
      sendDocument(logFile, "backup_error_" + timestamp + ".log", caption);
    } finally {
      Files.deleteIfExists(logFile);
    }
  }

  private void sendMessage(String p_text) throws IOException {
    HttpEntity entity = MultipartEntityBuilder.create()
        .setCharset(StandardCharsets.UTF_8)
        .addTextBody("chat_id", chatId)
        .addTextBody("text", p_text, ContentType.create("text/plain", StandardCharsets.UTF_8))
        .build();
    post("sendMessage", entity);
  }

  private void sendDocument(Path p_file, String p_fileName, String p_caption) throws IOException {
    HttpEntity entity = MultipartEntityBuilder.create()
        .setCharset(StandardCharsets.UTF_8)
        .addTextBody("chat_id", chatId)
        .addTextBody("caption", p_caption, ContentType.create("text/plain", StandardCharsets.UTF_8))
        .addBinaryBody("document", p_file.toFile(), ContentType.APPLICATION_OCTET_STREAM, p_fileName)
        .build();
    post("sendDocument", entity);
  }

  private void post(String p_method, HttpEntity p_entity) throws IOException {
    HttpPost post = new HttpPost(apiBase + "/bot" + botToken + "/" + p_method);
    post.setEntity(p_entity);
    try (CloseableHttpResponse resp = http.execute(post)) {
      int status = resp.getStatusLine().getStatusCode();
      String body = resp.getEntity() == null ? "" : EntityUtils.toString(resp.getEntity(), StandardCharsets.UTF_8);
      if (status / 100 != 2) {
        throw new IOException("Telegram " + p_method + " returned HTTP " + status + ": " + body);
      }
    }
  }

  @Override
  public void close() throws IOException {
    http.close();
  }

}
