package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrProtectionLevel;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;

/**
 * Reads package name, protection level and version metadata from the root executable.
 */
final class PackageHeaderExtractor {

    /** Protection level assumed when the attribute is absent (the designer omits its default). */
    static final IrProtectionLevel DEFAULT_LEVEL = IrProtectionLevel.ENCRYPT_SENSITIVE_WITH_USER_KEY;

    void extract(DtsxElement root, ExtractedPackage out) {
        String name = root.attrOrProperty("ObjectName");
        if (name == null || name.isBlank()) name = root.property("PackageName");
        if (name != null && !name.isBlank()) out.name = name.trim();

        String rawLevel = root.attrOrProperty("ProtectionLevel");
        IrProtectionLevel level = IrProtectionLevel.parse(rawLevel);
        if (level == null && rawLevel != null && !rawLevel.isBlank()) {
            out.diagnostics.report(DiagnosticCode.UNKNOWN_PROTECTION_LEVEL,
                    "Unrecognized protection level '" + rawLevel + "'", "protectionLevel", rawLevel);
            level = IrProtectionLevel.DONT_SAVE_SENSITIVE;
        } else if (level == null) {
            level = DEFAULT_LEVEL;
        }
        out.protectionLevel = level;

        out.creatorName = blankToNull(root.attrOrProperty("CreatorName"));
        out.creationDate = blankToNull(root.attrOrProperty("CreationDate"));
        out.versionBuild = blankToNull(root.attrOrProperty("VersionBuild"));
        out.versionComments = blankToNull(root.attrOrProperty("VersionComments"));
    }

    static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
