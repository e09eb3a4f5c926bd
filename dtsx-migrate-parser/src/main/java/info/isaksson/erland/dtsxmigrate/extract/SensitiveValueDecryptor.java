package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrProtectionLevel;

import java.util.Optional;

/**
 * Hook for decrypting sensitive values with a caller-supplied credential.
 *
 * <p>Decryption mechanics are not part of this library; without a decryptor every sensitive value
 * stored under an encrypting protection level is redacted.</p>
 */
@FunctionalInterface
public interface SensitiveValueDecryptor {

    /**
     * @return the plaintext, or empty when the value cannot be decrypted with {@code credential}
     */
    Optional<String> decrypt(String storedValue, String credential, IrProtectionLevel level);
}
