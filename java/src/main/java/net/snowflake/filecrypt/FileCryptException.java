package net.snowflake.filecrypt;

public class FileCryptException extends RuntimeException {
  public FileCryptException(String message) {
    super(message);
  }

  public FileCryptException(String message, Throwable cause) {
    super(message, cause);
  }

  public FileCryptException(Throwable cause) {
    super(cause);
  }
}
