package net.snowflake.filecrypt;

public class CipherParameterSpec {
  // JCE calls PKCS#7 padding "PKCS5Padding" for 16 byte blocks
  public static final CipherParameterSpec AES_CBC_PKCS7 =
      new CipherParameterSpec("AES", "CBC", "PKCS5Padding", 32, 16);

  static final int DEFAULT_BUFFER_SIZE = 1024 * 1024;

  private final String keyAlgorithm;
  private final String blockMode;
  private final String padding;
  private final int keyLength;
  private final int ivLength;
  private final int bufferSize;

  public CipherParameterSpec(String keyAlgorithm, String blockMode, String padding, int keyLength, int ivLength) {
    this(keyAlgorithm, blockMode, padding, keyLength, ivLength, DEFAULT_BUFFER_SIZE);
  }

  CipherParameterSpec(
      String keyAlgorithm,
      String blockMode,
      String padding,
      int keyLength,
      int ivLength,
      int bufferSize) {
    this.keyAlgorithm = keyAlgorithm;
    this.blockMode = blockMode;
    this.padding = padding;
    this.keyLength = keyLength;
    this.ivLength = ivLength;
    this.bufferSize = bufferSize;
    if (keyLength <= 0) {
      throw new IllegalArgumentException("keyLength must be > 0");
    }
    if (ivLength <= 0) {
      throw new IllegalArgumentException("ivLength must be > 0");
    }
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be > 0");
    }
  }

  CipherParameterSpec withBufferSize(int bufferSize) {
    return new CipherParameterSpec(keyAlgorithm, blockMode, padding, keyLength, ivLength, bufferSize);
  }

  public String getKeyAlgorithm() {
    return keyAlgorithm;
  }

  public String getTransformation() {
    return keyAlgorithm + "/" + blockMode + "/" + padding;
  }

  /**
   * Returns key length in bytes.
   *
   * @return key length in bytes.
   */
  public int getKeyLength() {
    return keyLength;
  }

  public int getIvLength() {
    return ivLength;
  }

  public int getBufferSize() {
    return bufferSize;
  }
}
