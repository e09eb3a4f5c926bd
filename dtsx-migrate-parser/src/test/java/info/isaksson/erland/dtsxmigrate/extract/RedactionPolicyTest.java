package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrProtectionLevel;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticSeverity;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RedactionPolicyTest {

    @Test
    void plainValuesPassThrough() {
        Diagnostics diag = new Diagnostics("P");
        RedactionPolicy policy = new RedactionPolicy(IrProtectionLevel.ENCRYPT_SENSITIVE_WITH_USER_KEY, null, null, diag);

        IrPropertyValue v = policy.apply("cm", "ServerName", "dw01", false);
        assertEquals("dw01", v.literal);
        assertEquals(0, diag.size());
    }

    @Test
    void flaggedAndPasswordNamedValuesAreRedactedWithoutCredential() {
        Diagnostics diag = new Diagnostics("P");
        RedactionPolicy policy = new RedactionPolicy(IrProtectionLevel.DONT_SAVE_SENSITIVE, null, null, diag);

        assertTrue(policy.apply("cm", "Token", "abc", true).redactedValue());
        assertTrue(policy.apply("cm", "Password", "hunter2", false).redactedValue());
        assertEquals(2, diag.size());
        IrDiagnostic first = diag.toDeterministicList().get(0);
        assertEquals(DiagnosticCode.REDACTED_VALUE, first.code);
        assertEquals(DiagnosticSeverity.INFO, first.severity);
    }

    @Test
    void connectionStringKeepsNonSecretSegments() {
        RedactionPolicy policy = new RedactionPolicy(IrProtectionLevel.DONT_SAVE_SENSITIVE, null, null, new Diagnostics("P"));

        IrPropertyValue v = policy.apply("cm", "ConnectionString", "Server=a;User ID=u;Pwd=x1;Database=d", false);
        assertEquals("Server=a;User ID=u;Pwd=[REDACTED];Database=d", v.literal);
    }

    @Test
    void redactionIsIdempotent() {
        RedactionPolicy policy = new RedactionPolicy(IrProtectionLevel.DONT_SAVE_SENSITIVE, null, null, new Diagnostics("P"));

        IrPropertyValue once = policy.apply("cm", "Password", "hunter2", true);
        IrPropertyValue twice = policy.apply("cm", "Password", once.literal, true);
        assertEquals(once, twice);

        String masked = policy.apply("cm", "ConnectionString", "Server=a;Password=x", false).literal;
        assertEquals(masked, policy.apply("cm", "ConnectionString", masked, false).literal);
    }

    @Test
    void decryptorSuppliesPlaintextWhenCredentialGiven() {
        Diagnostics diag = new Diagnostics("P");
        SensitiveValueDecryptor decryptor = (stored, credential, level) ->
                "AQAA".equals(stored) && "pw".equals(credential) ? Optional.of("plain") : Optional.empty();
        RedactionPolicy policy = new RedactionPolicy(IrProtectionLevel.ENCRYPT_SENSITIVE_WITH_PASSWORD, "pw", decryptor, diag);

        assertEquals("plain", policy.apply("cm", "Password", "AQAA", true).literal);
        assertEquals(0, diag.size());
    }

    @Test
    void failedDecryptionIsRedactedAndWarned() {
        Diagnostics diag = new Diagnostics("P");
        RedactionPolicy policy = new RedactionPolicy(IrProtectionLevel.ENCRYPT_SENSITIVE_WITH_PASSWORD, "wrong",
                (stored, credential, level) -> Optional.empty(), diag);

        assertTrue(policy.apply("cm", "Password", "AQAA", true).redactedValue());
        IrDiagnostic d = diag.toDeterministicList().get(0);
        assertEquals(DiagnosticCode.DECRYPTION_FAILED, d.code);
        assertEquals(DiagnosticSeverity.WARNING, d.severity);
    }

    @Test
    void unencryptedLevelWithCredentialKeepsStoredValue() {
        RedactionPolicy policy = new RedactionPolicy(IrProtectionLevel.DONT_SAVE_SENSITIVE, "pw", null, new Diagnostics("P"));
        assertEquals("hunter2", policy.apply("cm", "Password", "hunter2", true).literal);
    }
}
