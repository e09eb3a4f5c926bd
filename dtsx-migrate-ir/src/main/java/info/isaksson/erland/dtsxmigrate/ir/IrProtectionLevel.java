package info.isaksson.erland.dtsxmigrate.ir;

import java.util.Locale;

/** Package-wide policy describing whether and how sensitive values are encrypted. */
public enum IrProtectionLevel {
    DONT_SAVE_SENSITIVE(0, "DontSaveSensitive"),
    ENCRYPT_SENSITIVE_WITH_USER_KEY(1, "EncryptSensitiveWithUserKey"),
    ENCRYPT_SENSITIVE_WITH_PASSWORD(2, "EncryptSensitiveWithPassword"),
    ENCRYPT_ALL_WITH_PASSWORD(3, "EncryptAllWithPassword"),
    ENCRYPT_ALL_WITH_USER_KEY(4, "EncryptAllWithUserKey"),
    SERVER_STORAGE(5, "ServerStorage");

    public final int code;
    public final String dtsName;

    IrProtectionLevel(int code, String dtsName) {
        this.code = code;
        this.dtsName = dtsName;
    }

    public boolean encryptsSensitive() {
        return this == ENCRYPT_SENSITIVE_WITH_USER_KEY || this == ENCRYPT_SENSITIVE_WITH_PASSWORD || encryptsAll();
    }

    public boolean encryptsAll() {
        return this == ENCRYPT_ALL_WITH_PASSWORD || this == ENCRYPT_ALL_WITH_USER_KEY;
    }

    /**
     * Parse either the numeric code or the name used in package files.
     *
     * @return the level, or {@code null} when the value is not recognized
     */
    public static IrProtectionLevel parse(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.isEmpty()) return null;
        for (IrProtectionLevel l : values()) {
            if (String.valueOf(l.code).equals(v)) return l;
            if (l.dtsName.equalsIgnoreCase(v) || l.name().equals(v.toUpperCase(Locale.ROOT))) return l;
        }
        return null;
    }
}
