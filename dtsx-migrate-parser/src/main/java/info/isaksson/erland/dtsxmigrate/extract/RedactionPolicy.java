package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrProtectionLevel;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides what a sensitive property value turns into.
 *
 * <p>A value is sensitive when the document flags it ({@code Sensitive="1"}), when its name is a
 * password name, or when it is a connection string embedding a password. Sensitive values never
 * reach the IR in plaintext unless a credential was supplied and either the protection level stores
 * them unencrypted or the {@link SensitiveValueDecryptor} returned plaintext. Applying the policy to
 * an already redacted value yields the same marker.</p>
 */
public final class RedactionPolicy {

    private static final Set<String> PASSWORD_NAMES = Set.of("password", "userpassword", "pwd", "passwd", "secret");
    private static final Pattern CONNECTION_STRING_PASSWORD =
            Pattern.compile("(?i)((?:^|;)\\s*(?:password|pwd)\\s*=\\s*)([^;]*)");

    private final IrProtectionLevel level;
    private final String credential;
    private final SensitiveValueDecryptor decryptor;
    private final Diagnostics diagnostics;

    public RedactionPolicy(IrProtectionLevel level, String credential, SensitiveValueDecryptor decryptor, Diagnostics diagnostics) {
        this.level = level == null ? IrProtectionLevel.DONT_SAVE_SENSITIVE : level;
        this.credential = credential == null || credential.isEmpty() ? null : credential;
        this.decryptor = decryptor;
        this.diagnostics = diagnostics;
    }

    public static boolean passwordName(String propertyName) {
        return propertyName != null && PASSWORD_NAMES.contains(propertyName.toLowerCase(Locale.ROOT));
    }

    /** True when {@code value} is a connection string with a non-empty password segment. */
    public static boolean embedsPassword(String value) {
        if (value == null) return false;
        Matcher m = CONNECTION_STRING_PASSWORD.matcher(value);
        while (m.find()) {
            if (!m.group(2).isBlank()) return true;
        }
        return false;
    }

    public boolean sensitive(String propertyName, String value, boolean flagged) {
        return flagged || passwordName(propertyName) || embedsPassword(value);
    }

    /**
     * Apply the policy to one property.
     *
     * @param ownerId id of the connection manager or parameter owning the property (for diagnostics)
     */
    public IrPropertyValue apply(String ownerId, String propertyName, String rawValue, boolean flagged) {
        if (!sensitive(propertyName, rawValue, flagged)) {
            return IrPropertyValue.ofLiteral(rawValue);
        }
        if (IrPropertyValue.REDACTION_MARKER.equals(rawValue)) {
            redacted(ownerId, propertyName);
            return IrPropertyValue.redacted();
        }
        if (credential != null) {
            if (!level.encryptsSensitive() && rawValue != null) {
                return IrPropertyValue.ofLiteral(rawValue);
            }
            if (decryptor != null && rawValue != null) {
                Optional<String> plain = decryptor.decrypt(rawValue, credential, level);
                if (plain.isPresent()) return IrPropertyValue.ofLiteral(plain.get());
            }
            diagnostics.report(DiagnosticCode.DECRYPTION_FAILED,
                    "Sensitive value of " + ownerId + "." + propertyName + " could not be decrypted; redacted", "property", propertyName);
            return redactedValue(propertyName, rawValue, flagged);
        }
        redacted(ownerId, propertyName);
        return redactedValue(propertyName, rawValue, flagged);
    }

    public IrProtectionLevel level() {
        return level;
    }

    public boolean credentialSupplied() {
        return credential != null;
    }

    private IrPropertyValue redactedValue(String propertyName, String rawValue, boolean flagged) {
        // Connection strings keep their non-secret segments; only the password part is masked.
        if (!flagged && !passwordName(propertyName) && embedsPassword(rawValue)) {
            return IrPropertyValue.ofLiteral(maskConnectionString(rawValue));
        }
        return IrPropertyValue.redacted();
    }

    static String maskConnectionString(String value) {
        Matcher m = CONNECTION_STRING_PASSWORD.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1) + IrPropertyValue.REDACTION_MARKER));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private void redacted(String ownerId, String propertyName) {
        diagnostics.report(DiagnosticCode.REDACTED_VALUE,
                "Sensitive value of " + ownerId + "." + propertyName + " redacted", "property", propertyName);
    }
}
