package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrProtectionLevel;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.xml.DtsxDocument;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;
import info.isaksson.erland.dtsxmigrate.xml.MalformedDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads project-scoped parameters from a {@code Project.params} document
 * ({@code SSIS:Parameters/SSIS:Parameter} with {@code SSIS:Properties/SSIS:Property} children).
 */
public final class ProjectParametersReader {

    private static final Logger logger = LoggerFactory.getLogger(ProjectParametersReader.class);

    public List<IrParameter> read(String sourceName, byte[] content, ExtractOptions options, Diagnostics diagnostics)
            throws MalformedDocumentException {
        DtsxDocument doc = DtsxDocument.parse(sourceName, content);
        RedactionPolicy redaction = new RedactionPolicy(PackageHeaderExtractor.DEFAULT_LEVEL,
                options.decryptionCredential, options.decryptor, diagnostics);

        List<IrParameter> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (DtsxElement p : doc.root().descendants("Parameter")) {
            String name = PackageHeaderExtractor.blankToNull(p.attr("Name"));
            if (name == null || !seen.add(name)) continue;

            Map<String, DtsxElement> props = new LinkedHashMap<>();
            for (DtsxElement prop : p.descendants("Property")) {
                String key = prop.attr("Name");
                if (key != null) props.putIfAbsent(key, prop);
            }
            boolean sensitive = VariableExtractor.truthy(text(props, "Sensitive"));
            boolean required = VariableExtractor.truthy(text(props, "Required"));
            String rawValue = text(props, "Value");
            if (rawValue == null) rawValue = text(props, "ParameterValue");

            IrPropertyValue value = sensitive
                    ? redaction.apply(IrParameter.PROJECT_NAMESPACE + "::" + name, "Value", rawValue, true)
                    : IrPropertyValue.ofLiteral(rawValue);
            out.add(new IrParameter(IrParameter.PROJECT_NAMESPACE, name, null, text(props, "DataType"), sensitive, required, value));
        }
        logger.debug("Read {} project parameters from {}", out.size(), sourceName);
        return out;
    }

    private static String text(Map<String, DtsxElement> props, String name) {
        DtsxElement el = props.get(name);
        return el == null ? null : el.text();
    }
}
