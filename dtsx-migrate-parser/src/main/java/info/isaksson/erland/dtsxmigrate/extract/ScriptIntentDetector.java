package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrScriptIoIntent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Guesses whether a script task performs external I/O from its embedded source and its name.
 */
final class ScriptIntentDetector {

    private static final List<String> SOURCE_MARKERS = List.of(
            "System.IO", "File.", "Directory.", "StreamReader", "StreamWriter", "FileStream",
            "WebClient", "HttpClient", "HttpWebRequest", "WebRequest", "FtpWebRequest", "SmtpClient",
            "Blob", "S3", "Upload", "Download", "Dts.Connections[");

    private static final List<String> NAME_KEYWORDS = List.of("upload", "download", "sftp", "ftp", "http");

    static final class Result {
        final IrScriptIoIntent intent;
        final List<String> evidence;

        Result(IrScriptIoIntent intent, List<String> evidence) {
            this.intent = intent;
            this.evidence = List.copyOf(evidence);
        }
    }

    Result detect(List<String> sources, String name, String description) {
        List<String> evidence = new ArrayList<>();
        boolean hasSource = false;
        for (String src : sources) {
            if (src == null || src.isBlank()) continue;
            hasSource = true;
            for (String marker : SOURCE_MARKERS) {
                if (src.contains(marker) && !evidence.contains(marker)) evidence.add(marker);
            }
        }
        String label = ((name == null ? "" : name) + " " + (description == null ? "" : description)).toLowerCase(Locale.ROOT);
        for (String kw : NAME_KEYWORDS) {
            if (label.contains(kw)) {
                evidence.add("name:" + kw);
                break;
            }
        }
        if (!evidence.isEmpty()) return new Result(IrScriptIoIntent.EXTERNAL_IO, evidence);
        return new Result(hasSource ? IrScriptIoIntent.NONE : IrScriptIoIntent.UNKNOWN, evidence);
    }
}
