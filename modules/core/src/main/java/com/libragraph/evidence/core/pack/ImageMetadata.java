package com.libragraph.evidence.core.pack;

import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.util.EdrmDates;
import com.libragraph.evidence.util.XmlText;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.time.Instant;

/**
 * The {@code image_metadata.xml} document of a container.
 */
final class ImageMetadata {

    private ImageMetadata() {
    }

    static Document build(EvidenceConfig.ImageMetadata image, Instant createdAt) {
        Document doc;
        try {
            doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No XML document builder available", e);
        }
        Element root = doc.createElement("image-metadata");
        doc.appendChild(root);
        Element properties = doc.createElement("properties");
        root.appendChild(properties);

        property(properties, "case-number", image.caseNumber());
        property(properties, "creation-datetime", EdrmDates.formatImageTimestamp(createdAt));
        property(properties, "creation-software-name", image.softwareName());
        property(properties, "creation-software-version", image.softwareVersion());
        property(properties, "evidence-number", image.evidenceNumber());
        property(properties, "examiner-name", image.examinerName());
        return doc;
    }

    private static void property(Element properties, String key, String value) {
        Element property = properties.getOwnerDocument().createElement("property");
        property.setAttribute("key", key);
        property.setAttribute("value", XmlText.sanitize(value));
        properties.appendChild(property);
    }
}
