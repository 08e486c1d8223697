package com.daveeberhart.db_util.secure_backup.error;

/**
 * Causes launcher to print this error, the commandline usage, and then exit.
 */
public class BadArgsException extends RuntimeException {

  public BadArgsException(String p_mesg) {
    super(p_mesg);
  }

}
