package com.cnj.saude.report;

import com.cnj.saude.analysis.AnalysisReport;
import com.cnj.saude.analysis.FrequencyTable;
import com.cnj.saude.analysis.ReportSection;
import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.report.ReportTableFormatter.ReportLine;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;

/**
 * Renders the analysis as one paginated A4 document with Apache PDFBox.
 *
 * <p>Each section starts on a new page. The public-defendant part is preceded by a divider page,
 * placed no earlier than the configured start page. Every page carries a {@code Pagina n/N}
 * footer.
 */
public class PdfReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(PdfReportSink.class);

    public static final String DOCUMENT_TITLE = "Analise de Processos de Saude - CNJ";
    public static final String DIVIDER_TITLE = "Processos contra Entes Publicos";
    public static final String FOOTER_FORMAT = "Pagina %d/%d";

    private static final PDFont REGULAR = PDType1Font.HELVETICA;
    private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;

    private static final float MARGIN = 50f;
    private static final float FOOTER_Y = 25f;
    private static final float LINE_HEIGHT = 13f;
    private static final float BODY_SIZE = 9f;
    private static final float HEADING_SIZE = 11f;
    private static final float TITLE_SIZE = 15f;
    private static final float COUNT_RIGHT = 470f;
    private static final float PERCENT_RIGHT = 545f;
    private static final float ITEM_WIDTH = 330f;

    private final Path target;
    private final ReportTableFormatter formatter;
    private final int publicDefendantStartPage;

    public PdfReportSink(PipelineConfig config) {
        this.target = config.getReportsDir().resolve(config.getReportBaseName() + ".pdf");
        this.formatter = new ReportTableFormatter(config.getTopN());
        this.publicDefendantStartPage = config.getPublicDefendantStartPage();
    }

    @Override
    public void publish(AnalysisReport report) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        int pages;
        try (PDDocument document = new PDDocument()) {
            try (PageWriter writer = new PageWriter(document)) {
                boolean first = true;
                for (ReportSection section : report.getSections()) {
                    if (section.startsSubset()) {
                        writer.dividerPage(DIVIDER_TITLE, publicDefendantStartPage);
                    }
                    writer.newPage();
                    if (first) {
                        writer.line(DOCUMENT_TITLE, BOLD, TITLE_SIZE, MARGIN);
                        writer.skip(LINE_HEIGHT);
                        first = false;
                    }
                    writeSection(writer, section);
                }
                if (document.getNumberOfPages() == 0) {
                    writer.newPage();
                    writer.line(DOCUMENT_TITLE, BOLD, TITLE_SIZE, MARGIN);
                }
            }
            addFooters(document);
            pages = document.getNumberOfPages();
            document.save(temp.toFile());
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        move(temp, target);
        log.info("Wrote PDF report {} ({} page(s))", target, pages);
    }

    public Path getTarget() {
        return target;
    }

    private void writeSection(PageWriter writer, ReportSection section) throws IOException {
        writer.line(section.title(), BOLD, HEADING_SIZE + 2, MARGIN);
        writer.line(String.format(Locale.ROOT, "Processos analisados: %,d", section.rowCount()), REGULAR, BODY_SIZE, MARGIN);
        writer.skip(LINE_HEIGHT / 2);

        for (FrequencyTable table : section.tables()) {
            List<ReportLine> lines = formatter.format(table);
            writer.ensureSpace(LINE_HEIGHT * 3);
            writer.line("Analise: " + table.getColumn(), BOLD, HEADING_SIZE, MARGIN);
            if (lines.isEmpty()) {
                writer.line("Nenhum registro.", REGULAR, BODY_SIZE, MARGIN);
            } else {
                writer.row("Item", "Contagem", "Percentual", BOLD);
                for (ReportLine line : lines) {
                    writer.ensureSpace(LINE_HEIGHT);
                    PDFont font = ReportTableFormatter.TOTAL_LABEL.equals(line.item()) ? BOLD : REGULAR;
                    writer.row(line.item(), String.format(Locale.ROOT, "%,d", line.count()), line.percentText(), font);
                }
            }
            writer.skip(LINE_HEIGHT);
        }
    }

    private static void addFooters(PDDocument document) throws IOException {
        int total = document.getNumberOfPages();
        for (int i = 0; i < total; i++) {
            PDPage page = document.getPage(i);
            String footer = String.format(FOOTER_FORMAT, i + 1, total);
            float width = textWidth(footer, REGULAR, BODY_SIZE);
            float x = (page.getMediaBox().getWidth() - width) / 2;
            try (PDPageContentStream stream = new PDPageContentStream(document, page, AppendMode.APPEND, true, true)) {
                showText(stream, footer, REGULAR, BODY_SIZE, x, FOOTER_Y);
            }
        }
    }

    private static void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain move", destination);
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static float textWidth(String text, PDFont font, float size) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    private static void showText(PDPageContentStream stream, String text, PDFont font, float size,
                                 float x, float y) throws IOException {
        stream.beginText();
        stream.setFont(font, size);
        stream.newLineAtOffset(x, y);
        stream.showText(text);
        stream.endText();
    }

    /**
     * Cursor over the pages being written; keeps one content stream open at a time.
     */
    private static final class PageWriter implements AutoCloseable {

        private final PDDocument document;
        private PDPageContentStream stream;
        private float y;

        PageWriter(PDDocument document) {
            this.document = document;
        }

        void newPage() throws IOException {
            closeStream();
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }

        void dividerPage(String title, int startPage) throws IOException {
            closeStream();
            while (document.getNumberOfPages() + 1 < startPage) {
                document.addPage(new PDPage(PDRectangle.A4));
            }
            newPage();
            float width = textWidth(title, BOLD, TITLE_SIZE + 3);
            float x = (PDRectangle.A4.getWidth() - width) / 2;
            showText(stream, title, BOLD, TITLE_SIZE + 3, x, PDRectangle.A4.getHeight() / 2);
        }

        void ensureSpace(float height) throws IOException {
            if (stream == null || y - height < MARGIN) {
                newPage();
            }
        }

        void skip(float height) {
            y -= height;
        }

        void line(String text, PDFont font, float size, float x) throws IOException {
            ensureSpace(size + 4);
            y -= size + 4;
            showText(stream, ReportNames.pdfSafe(text), font, size, x, y);
        }

        void row(String item, String count, String percent, PDFont font) throws IOException {
            ensureSpace(LINE_HEIGHT);
            y -= LINE_HEIGHT;
            showText(stream, fit(ReportNames.pdfSafe(item), font), font, BODY_SIZE, MARGIN, y);
            String safeCount = ReportNames.pdfSafe(count);
            showText(stream, safeCount, font, BODY_SIZE, COUNT_RIGHT - textWidth(safeCount, font, BODY_SIZE), y);
            String safePercent = ReportNames.pdfSafe(percent);
            showText(stream, safePercent, font, BODY_SIZE, PERCENT_RIGHT - textWidth(safePercent, font, BODY_SIZE), y);
        }

        private static String fit(String text, PDFont font) throws IOException {
            if (textWidth(text, font, BODY_SIZE) <= ITEM_WIDTH) {
                return text;
            }
            String shortened = text;
            while (!shortened.isEmpty() && textWidth(shortened + "...", font, BODY_SIZE) > ITEM_WIDTH) {
                shortened = shortened.substring(0, shortened.length() - 1);
            }
            return shortened + "...";
        }

        private void closeStream() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        @Override
        public void close() throws IOException {
            closeStream();
        }
    }
}
