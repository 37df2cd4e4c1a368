package com.garageadmin.pdf;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Flowing A4 writer on top of PDFBox. Keeps a cursor measured from the top
 * of the page and starts a new page when content would cross the bottom
 * margin.
 */
@Slf4j
public class PdfPageWriter implements Closeable {

    public static final float MARGIN = 50f;
    public static final PDFont REGULAR = PDType1Font.HELVETICA;
    public static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;

    private static final float LINE_END = 550f;
    private static final float HEADER_TOP = 40f;
    private static final float DIVIDER_Y = 110f;
    private static final float LOGO_WIDTH = 220f;
    private static final float LOGO_HEIGHT = 60f;

    private final PDDocument document;
    private PDPage page;
    private PDPageContentStream stream;
    private float y;

    private PDFont font = REGULAR;
    private float fontSize = 12f;

    public PdfPageWriter() throws IOException {
        this.document = new PDDocument();
        newPage();
    }

    public void newPage() throws IOException {
        if (stream != null) {
            stream.close();
        }
        page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        stream = new PDPageContentStream(document, page);
        y = MARGIN;
    }

    public void font(PDFont font, float size) {
        this.font = font;
        this.fontSize = size;
    }

    public void moveDown(float lines) {
        y += lines * leading();
    }

    public float cursor() {
        return y;
    }

    /**
     * Logo on the left with the title beside it, or a centered title when
     * no usable logo is configured. Ends with a light divider.
     */
    public void header(String title, Path logo) throws IOException {
        PDImageXObject image = loadLogo(logo);
        font(REGULAR, 18f);
        if (image != null) {
            float scale = Math.min(LOGO_WIDTH / image.getWidth(), LOGO_HEIGHT / image.getHeight());
            float w = image.getWidth() * scale;
            float h = image.getHeight() * scale;
            stream.drawImage(image, MARGIN, pageHeight() - HEADER_TOP - h, w, h);
            drawText(MARGIN + LOGO_WIDTH + 20f, HEADER_TOP + 15f, title);
        } else {
            centered(title);
        }

        stream.setStrokingColor(0xe5 / 255f, 0xe7 / 255f, 0xeb / 255f);
        stream.moveTo(MARGIN, pageHeight() - DIVIDER_Y);
        stream.lineTo(LINE_END, pageHeight() - DIVIDER_Y);
        stream.stroke();
        stream.setStrokingColor(0f, 0f, 0f);

        font(REGULAR, 12f);
        moveDown(0.5f);
        y = Math.max(y, DIVIDER_Y + 10f);
    }

    public void centered(String text) throws IOException {
        ensureRoom(leading());
        float width = width(text);
        drawText((page.getMediaBox().getWidth() - width) / 2, y, text);
        y += leading();
    }

    /** One line at the left margin; long text wraps. */
    public void text(String text) throws IOException {
        for (String line : wrap(text, LINE_END - MARGIN)) {
            ensureRoom(leading());
            drawText(MARGIN, y, line);
            y += leading();
        }
    }

    public void underlined(String text) throws IOException {
        ensureRoom(leading());
        drawText(MARGIN, y, text);
        float baseline = pageHeight() - y - fontSize * 0.8f - 1.5f;
        stream.moveTo(MARGIN, baseline);
        stream.lineTo(MARGIN + width(text), baseline);
        stream.stroke();
        y += leading();
    }

    /** Text flush with the right margin. */
    public void rightAligned(String text) throws IOException {
        ensureRoom(leading());
        float right = page.getMediaBox().getWidth() - MARGIN;
        drawText(right - width(text), y, text);
        y += leading();
    }

    public void rule() throws IOException {
        stream.moveTo(MARGIN, pageHeight() - y);
        stream.lineTo(LINE_END, pageHeight() - y);
        stream.stroke();
    }

    /**
     * A table row. Each cell wraps inside its column; the row is as tall as
     * its tallest cell and moves to a fresh page when it does not fit.
     */
    public void row(float[] xs, float[] widths, String... cells) throws IOException {
        List<List<String>> wrapped = new ArrayList<>();
        int lines = 1;
        for (int i = 0; i < cells.length; i++) {
            List<String> cell = wrap(cells[i], widths[i]);
            wrapped.add(cell);
            lines = Math.max(lines, cell.size());
        }
        float height = lines * leading();
        ensureRoom(height);
        for (int i = 0; i < wrapped.size(); i++) {
            float lineY = y;
            for (String line : wrapped.get(i)) {
                drawText(xs[i], lineY, line);
                lineY += leading();
            }
        }
        y += height;
    }

    public byte[] toByteArray() throws IOException {
        stream.close();
        stream = null;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
    }

    @Override
    public void close() throws IOException {
        try {
            if (stream != null) {
                stream.close();
            }
        } finally {
            document.close();
        }
    }

    // ------------------------------------------------------------ internals

    private float leading() {
        return fontSize * 1.2f;
    }

    private float pageHeight() {
        return page.getMediaBox().getHeight();
    }

    private void ensureRoom(float height) throws IOException {
        if (y + height > pageHeight() - MARGIN) {
            newPage();
        }
    }

    private void drawText(float x, float top, String text) throws IOException {
        stream.beginText();
        stream.setFont(font, fontSize);
        stream.newLineAtOffset(x, pageHeight() - top - fontSize * 0.8f);
        stream.showText(sanitize(text));
        stream.endText();
    }

    private float width(String text) throws IOException {
        return font.getStringWidth(sanitize(text)) / 1000f * fontSize;
    }

    List<String> wrap(String text, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        String clean = sanitize(text);
        if (clean.isEmpty()) {
            lines.add("");
            return lines;
        }
        StringBuilder current = new StringBuilder();
        for (String word : clean.split(" ")) {
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (width(candidate) <= maxWidth) {
                current.setLength(0);
                current.append(candidate);
                continue;
            }
            if (current.length() > 0) {
                lines.add(current.toString());
                current.setLength(0);
            }
            // a single word wider than the column is cut by characters
            while (width(word) > maxWidth && word.length() > 1) {
                int cut = word.length() - 1;
                while (cut > 1 && width(word.substring(0, cut)) > maxWidth) {
                    cut--;
                }
                lines.add(word.substring(0, cut));
                word = word.substring(cut);
            }
            current.append(word);
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    /** Standard 14 fonts only cover WinAnsi; anything else becomes '?'. */
    private String sanitize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (Character.isWhitespace(cp)) {
                out.append(' ');
            } else if (encodable(cp)) {
                out.appendCodePoint(cp);
            } else {
                out.append('?');
            }
        });
        return out.toString();
    }

    private boolean encodable(int codePoint) {
        try {
            font.encode(new String(Character.toChars(codePoint)));
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private PDImageXObject loadLogo(Path logo) {
        if (logo == null || !Files.isReadable(logo)) {
            return null;
        }
        try {
            return PDImageXObject.createFromFile(logo.toString(), document);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("PDF logo failed to load from {}: {}", logo, e.getMessage());
            return null;
        }
    }
}
