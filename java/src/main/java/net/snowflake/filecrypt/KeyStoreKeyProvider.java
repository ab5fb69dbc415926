package net.snowflake.filecrypt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Objects;

/**
 * {@link KeyProvider} backed by a PKCS12 key store file. The key is generated on first use and
 * stored under the configured alias; later calls, and later instances pointing at the same file,
 * return the same key.
 */
public class KeyStoreKeyProvider implements KeyProvider {
  private static final Logger logger = LoggerFactory.getLogger(KeyStoreKeyProvider.class);

  public static final String DEFAULT_ALIAS = "FILE_ENCRYPTED";
  private static final String KEY_STORE_TYPE = "PKCS12";

  private final Path keyStorePath;
  private final String alias;
  private final char[] password;
  private final CipherParameterSpec parameterSpec;

  private SecretKey key;

  private KeyStoreKeyProvider(Path keyStorePath, String alias, char[] password, CipherParameterSpec parameterSpec) {
    this.keyStorePath = keyStorePath;
    this.alias = alias;
    this.password = password;
    this.parameterSpec = parameterSpec;
  }

  public static Builder builder(Path keyStorePath, char[] password) {
    return new Builder(keyStorePath, password);
  }

  @Override
  public synchronized SecretKey getKey() {
    if (key == null) {
      try {
        key = loadOrGenerate();
      } catch (GeneralSecurityException | IOException e) {
        throw new SecurityException("unable to obtain key " + alias + " from " + keyStorePath, e);
      }
    }
    return key;
  }

  private SecretKey loadOrGenerate() throws GeneralSecurityException, IOException {
    KeyStore keyStore = KeyStore.getInstance(KEY_STORE_TYPE);
    if (Files.exists(keyStorePath)) {
      try (InputStream in = Files.newInputStream(keyStorePath)) {
        keyStore.load(in, password);
      }
    } else {
      keyStore.load(null, password);
    }
    KeyStore.ProtectionParameter protection = new KeyStore.PasswordProtection(password);
    if (!keyStore.containsAlias(alias)) {
      SecretKey generated = generateKey();
      keyStore.setEntry(alias, new KeyStore.SecretKeyEntry(generated), protection);
      store(keyStore);
      logger.info("Generated new key {} in {}", alias, keyStorePath);
      return generated;
    }
    KeyStore.Entry entry = keyStore.getEntry(alias, protection);
    if (!(entry instanceof KeyStore.SecretKeyEntry)) {
      throw new SecurityException("key store entry " + alias + " is not a secret key");
    }
    byte[] encoded = ((KeyStore.SecretKeyEntry) entry).getSecretKey().getEncoded();
    if (encoded == null || encoded.length != parameterSpec.getKeyLength()) {
      throw new SecurityException("invalid key length for " + alias);
    }
    return new SecretKeySpec(encoded, parameterSpec.getKeyAlgorithm());
  }

  private SecretKey generateKey() throws GeneralSecurityException {
    KeyGenerator generator = KeyGenerator.getInstance(parameterSpec.getKeyAlgorithm());
    generator.init(parameterSpec.getKeyLength() * 8);
    return generator.generateKey();
  }

  private void store(KeyStore keyStore) throws GeneralSecurityException, IOException {
    Path parent = keyStorePath.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(keyStorePath)) {
      keyStore.store(out, password);
    }
  }

  public static class Builder {
    private final Path keyStorePath;
    private String alias = DEFAULT_ALIAS;
    private final char[] password;
    private CipherParameterSpec parameterSpec = CipherParameterSpec.AES_CBC_PKCS7;

    private Builder(Path keyStorePath, char[] password) {
      this.keyStorePath = Objects.requireNonNull(keyStorePath, "keyStorePath");
      this.password = Objects.requireNonNull(password, "password").clone();
      if (this.password.length == 0) {
        throw new IllegalArgumentException("key store password must not be empty");
      }
    }

    public Builder setAlias(String alias) {
      this.alias = Objects.requireNonNull(alias, "alias");
      return this;
    }

    public Builder setParameterSpec(CipherParameterSpec parameterSpec) {
      this.parameterSpec = Objects.requireNonNull(parameterSpec, "parameterSpec");
      return this;
    }

    public KeyStoreKeyProvider build() {
      return new KeyStoreKeyProvider(keyStorePath, alias, password, parameterSpec);
    }
  }
}
