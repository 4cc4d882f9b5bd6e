package com.example.stitchschemata.service.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.AdobePDFSchema;
import org.apache.xmpbox.schema.PDFAIdentificationSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.XmpSerializer;
import org.springframework.stereotype.Component;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Calendar;

/**
 * Writes matching XMP and document-information metadata: creation and metadata
 * dates, creator tool and the PDF/A-1B identification.
 */
@Component
public class PdfMetadataStamper {

    public static final String CREATOR_TOOL = "stitch-schemata";

    public void stamp(PDDocument document, String creatorTool, Calendar now) throws IOException {
        String tool = creatorTool == null || creatorTool.isBlank() ? CREATOR_TOOL : creatorTool;

        XMPMetadata xmp = XMPMetadata.createXMPMetadata();
        try {
            PDFAIdentificationSchema identification = xmp.createAndAddPFAIdentificationSchema();
            identification.setPart(1);
            identification.setConformance("B");

            XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
            basic.setCreateDate(now);
            basic.setModifyDate(now);
            basic.setMetadataDate(now);
            basic.setCreatorTool(tool);

            AdobePDFSchema pdf = xmp.createAndAddAdobePDFSchema();
            pdf.setProducer(tool);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            new XmpSerializer().serialize(xmp, out, true);

            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata(out.toByteArray());
            document.getDocumentCatalog().setMetadata(metadata);
        } catch (BadFieldValueException | TransformerException e) {
            throw new IOException("Unable to build XMP metadata", e);
        }

        PDDocumentInformation info = document.getDocumentInformation();
        info.setCreator(tool);
        info.setProducer(tool);
        info.setCreationDate(now);
        info.setModificationDate(now);
    }
}
