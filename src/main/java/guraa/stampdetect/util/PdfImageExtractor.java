package guraa.stampdetect.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.contentstream.operator.state.SetGraphicsStateParameters;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDInlineImage;

import java.awt.image.BufferedImage;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Walks a page's content stream and collects every raster it paints: image XObjects,
 * images inside form XObjects, and inline images.
 * Instances are not thread safe; use one per document.
 */
@Slf4j
public class PdfImageExtractor extends PDFStreamEngine {

    private final List<BufferedImage> images = new ArrayList<>();
    private final Set<COSBase> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private int pageIndex;

    public PdfImageExtractor() {
        addOperator(new Concatenate());
        addOperator(new SetGraphicsStateParameters());
        addOperator(new Save());
        addOperator(new Restore());
    }

    /**
     * Extract the distinct images painted on one page.
     *
     * @param page The page
     * @param pageIndex Zero-based index, for logging
     * @return Decoded images in paint order
     * @throws IOException If the content stream cannot be parsed
     */
    public List<BufferedImage> extractImagesFromPage(PDPage page, int pageIndex) throws IOException {
        images.clear();
        seen.clear();
        this.pageIndex = pageIndex;

        try {
            processPage(page);
        } catch (EOFException e) {
            log.warn("EOF encountered while extracting images from page {}: {}", pageIndex + 1, e.getMessage());
        }

        log.debug("Extracted {} images from page {}", images.size(), pageIndex + 1);
        return new ArrayList<>(images);
    }

    @Override
    protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
        String operation = operator.getName();

        if ("Do".equals(operation)) {
            drawObject(operands);
        } else if ("BI".equals(operation)) {
            drawInlineImage(operator);
        } else {
            super.processOperator(operator, operands);
        }
    }

    private void drawObject(List<COSBase> operands) throws IOException {
        if (operands == null || operands.isEmpty() || !(operands.get(0) instanceof COSName)) {
            return;
        }
        COSName objectName = (COSName) operands.get(0);
        PDResources resources = getResources();
        if (resources == null) {
            return;
        }

        PDXObject xobject;
        try {
            xobject = resources.getXObject(objectName);
        } catch (IOException e) {
            log.warn("Could not retrieve XObject {} on page {}: {}", objectName.getName(), pageIndex + 1, e.getMessage());
            return;
        }

        if (xobject instanceof PDImageXObject) {
            PDImageXObject image = (PDImageXObject) xobject;
            if (!seen.add(image.getCOSObject())) {
                return;
            }
            try {
                addImage(image.getImage(), objectName.getName());
            } catch (IOException | RuntimeException e) {
                log.warn("Could not decode image {} on page {}: {}", objectName.getName(), pageIndex + 1, e.getMessage());
            }
        } else if (xobject instanceof PDFormXObject) {
            PDFormXObject form = (PDFormXObject) xobject;
            if (seen.add(form.getCOSObject())) {
                showForm(form);
            }
        }
    }

    private void drawInlineImage(Operator operator) {
        if (operator.getImageParameters() == null || operator.getImageData() == null) {
            return;
        }
        try {
            PDInlineImage inline = new PDInlineImage(operator.getImageParameters(), operator.getImageData(), getResources());
            addImage(inline.getImage(), "inline");
        } catch (IOException | RuntimeException e) {
            log.warn("Could not decode inline image on page {}: {}", pageIndex + 1, e.getMessage());
        }
    }

    private void addImage(BufferedImage image, String name) {
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            log.debug("Ignoring empty image {} on page {}", name, pageIndex + 1);
            return;
        }
        images.add(image);
    }
}
