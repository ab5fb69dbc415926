package net.snowflake.filecrypt;

import javax.crypto.SecretKey;

/**
 * Source of the symmetric key used for file encryption. Implementations own the key and its
 * persistence; callers only borrow it for the duration of a single operation.
 */
@FunctionalInterface
public interface KeyProvider {
  /**
   * Returns the key, generating and persisting it first if it does not exist yet.
   *
   * @return the secret key.
   * @throws SecurityException if the key cannot be retrieved or generated.
   */
  SecretKey getKey();
}
