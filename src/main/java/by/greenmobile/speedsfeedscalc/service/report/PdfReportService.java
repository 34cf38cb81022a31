package by.greenmobile.speedsfeedscalc.service.report;

import by.greenmobile.speedsfeedscalc.entity.CalculationResult;
import by.greenmobile.speedsfeedscalc.entity.MachineLimits;
import by.greenmobile.speedsfeedscalc.entity.MachiningInputs;
import by.greenmobile.speedsfeedscalc.entity.MachiningOutputs;
import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import by.greenmobile.speedsfeedscalc.service.engine.CuttingPowerModel;
import by.greenmobile.speedsfeedscalc.service.engine.Units;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.font.encoding.GlyphList;
import org.apache.pdfbox.pdmodel.font.encoding.WinAnsiEncoding;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * A4 engineering report for one calculation: summary, inputs, step-by-step formulas, all warnings.
 */
@Service
@Slf4j
public class PdfReportService {

    private static final float M = 50f;
    private static final float W = PDRectangle.A4.getWidth();
    private static final float H = PDRectangle.A4.getHeight();
    private static final float MAX_WIDTH = W - 2 * M;

    private final PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDFont fontBold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    private final PDFont fontMono = new PDType1Font(Standard14Fonts.FontName.COURIER);

    private final CuttingPowerModel powerModel;

    public PdfReportService(CuttingPowerModel powerModel) {
        this.powerModel = powerModel;
    }

    public byte[] buildEngineeringReport(CalculationResult r) throws IOException {
        if (r == null || r.getOutputs() == null) {
            throw new IllegalArgumentException("No calculation result to report");
        }

        try (PDDocument doc = new PDDocument()) {
            Cursor c = new Cursor(doc);
            writeHeader(c, "SPEEDS & FEEDS REPORT");
            writeSummaryPage(c, r);

            c.newPage();
            writeHeader(c, "INPUTS");
            writeInputsPage(c, r);

            c.newPage();
            writeHeader(c, "CALCULATION STEPS");
            writeCalculationPage(c, r);

            c.newPage();
            writeHeader(c, "WARNINGS");
            writeWarningsPage(c, r.getWarnings());

            // stream has to be closed before save
            c.close();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            log.info("PDF report built: {} pages, {} bytes", doc.getNumberOfPages(), out.size());
            return out.toByteArray();
        }
    }

    private void writeSummaryPage(Cursor c, CalculationResult r) throws IOException {
        float y = c.y;
        MachiningOutputs o = r.getOutputs();

        y = h2(c, y, "Summary");
        y = kv(c, y, "Date", LocalDate.now().format(DateTimeFormatter.ofPattern("dd.MM.yyyy")));
        y = kv(c, y, "Spindle speed", fmt0(o.getRpm()) + " RPM");
        y = kv(c, y, "RPM status", r.getRpmStatus().status() + " - " + r.getRpmStatus().message());
        y = kv(c, y, "Feed", fmt0(o.getFeed()) + " mm/min (" + fmt(r.getFeedInchesPerMinute()) + " in/min)");
        y = kv(c, y, "Feed per tooth (commanded)", fmt4(o.getEffectiveChipLoad()) + " mm");
        y = kv(c, y, "Material removal rate", fmt(o.getMaterialRemovalRateCm3()) + " cm3/min");
        y = kv(c, y, "Spindle power", fmt(o.getSpindlePowerKw()) + " kW");
        y = kv(c, y, "Torque", fmt(o.getTorqueNm()) + " N·m");
        if (r.getSpindleLoadPercent() != null) {
            y = kv(c, y, "Spindle load", fmt0(r.getSpindleLoadPercent()) + " %");
        }
        y = kv(c, y, "Warnings", String.valueOf(r.getWarnings() == null ? 0 : r.getWarnings().size()));

        c.y = y;
    }

    private void writeInputsPage(Cursor c, CalculationResult r) throws IOException {
        float y = c.y;
        MachiningInputs in = r.getInputs();

        y = h2(c, y, "Tool");
        y = kv(c, y, "Diameter", fmt(in.getDiameter()) + " mm");
        y = kv(c, y, "Flutes", in.getFluteNum() == null ? "-" : String.valueOf(in.getFluteNum()));
        y = kv(c, y, "Stickout", fmt(in.getToolStickout()) + " mm");
        y = kv(c, y, "Coating", in.getCoating() == null || in.getCoating().isBlank() ? "uncoated" : in.getCoating());

        y -= 8;
        y = h2(c, y, "Material");
        MaterialRecord m = r.getMaterial();
        if (m != null) {
            y = kv(c, y, "Material", m.name());
            y = kv(c, y, "Recommended speed", fmt0(m.smm()) + " m/min (" + fmt0(m.sfm()) + " SFM)");
            y = kv(c, y, "Recommended chip load", fmt4(m.chipLoadMm()) + " mm");
        } else {
            y = kv(c, y, "Material", "not selected");
        }
        y = kv(c, y, "kc", fmt0(in.getKc()) + " N/mm2");

        y -= 8;
        y = h2(c, y, "Cut");
        y = kv(c, y, "Depth of cut (DOC)", fmt(in.getDoc()) + " mm");
        y = kv(c, y, "Width of cut (WOC)", fmt(in.getWoc()) + " mm");
        y = kv(c, y, "Surface speed", fmt0(in.getSmm()) + " m/min (" + fmt0(nz(in.getSmm()) * Units.M_TO_FT) + " SFM)");
        y = kv(c, y, "Feed per tooth (nominal)", fmt4(in.getMmpt()) + " mm");
        y = kv(c, y, "HSM", in.isHsmEnabled() ? "on" : "off");
        y = kv(c, y, "Chip thinning compensation", in.isChipThinningEnabled() ? "on" : "off");

        y -= 8;
        y = h2(c, y, "Machine");
        MachineLimits l = r.getMachineLimits();
        y = kv(c, y, "Rigidity", r.getRigidityName());
        y = kv(c, y, "RPM min / preferred / max",
                fmt0(l.minRpm()) + " / " + fmt0(l.preferredRpm()) + " / " + fmt0(l.maxRpm()));
        y = kv(c, y, "Spindle power", l.spindlePowerKw() > 0 ? fmt(l.spindlePowerKw()) + " kW" : "not specified");

        c.y = y;
    }

    private void writeCalculationPage(Cursor c, CalculationResult r) throws IOException {
        float y = c.y;
        MachiningInputs in = r.getInputs();
        MachiningOutputs o = r.getOutputs();

        y = h2(c, y, "Step 1. Spindle speed");
        y = codeLine(c, y, "n = Vc * 1000 / (pi * D)");
        y = codeLine(c, y, "n = " + fmt(in.getSmm()) + " * 1000 / (pi * " + fmt(in.getDiameter()) + ") = "
                + fmt0(o.getRpm()) + " RPM");

        y -= 6;
        y = h2(c, y, "Step 2. Chip thinning");
        double ratio = nz(in.getWoc()) / nz(in.getDiameter());
        y = codeLine(c, y, "ae/D = " + fmt(in.getWoc()) + " / " + fmt(in.getDiameter()) + " = " + fmt(ratio));
        y = codeLine(c, y, "fz_eff = fz * k = " + fmt4(in.getMmpt()) + " * " + fmt(o.getChipThinningFactor())
                + " = " + fmt4(o.getEffectiveChipLoad()) + " mm");
        if (o.getChipThinningFactor() > 1.0) {
            y = paragraph(c, y, "k = 1 / sqrt(1 - (1 - 2*ae/D)^2), applied because HSM and chip thinning are enabled "
                    + "and the radial engagement is below 50%.");
        }

        y -= 6;
        y = h2(c, y, "Step 3. Feed");
        y = codeLine(c, y, "Vf = n * z * fz_eff = " + fmt0(o.getRpm()) + " * " + in.getFluteNum() + " * "
                + fmt4(o.getEffectiveChipLoad()) + " = " + fmt0(o.getFeed()) + " mm/min");

        y -= 6;
        y = h2(c, y, "Step 4. Material removal rate");
        y = codeLine(c, y, "Q = ap * ae * Vf = " + fmt(in.getDoc()) + " * " + fmt(in.getWoc()) + " * "
                + fmt0(o.getFeed()) + " = " + fmt0(o.getMaterialRemovalRate()) + " mm3/min");

        y -= 6;
        y = h2(c, y, "Step 5. Power and torque");
        y = codeLine(c, y, "Pc = Q * kc / 60e6 = " + fmt(o.getCuttingPowerKw()) + " kW");
        y = codeLine(c, y, "P = Pc / eta = " + fmt(o.getCuttingPowerKw()) + " / "
                + fmt(powerModel.getSpindleEfficiency()) + " = " + fmt(o.getSpindlePowerKw()) + " kW");
        y = codeLine(c, y, "M = Pc * 1000 / (2 * pi * n / 60) = " + fmt(o.getTorqueNm()) + " N·m");

        c.y = y;
    }

    private void writeWarningsPage(Cursor c, List<String> warnings) throws IOException {
        float y = c.y;
        if (warnings == null || warnings.isEmpty()) {
            y = paragraph(c, y, "No warnings. The parameters are within all checked limits.");
        } else {
            int i = 1;
            for (String w : warnings) {
                y = paragraph(c, y, i++ + ") " + w);
            }
        }
        y -= 10;
        y = paragraph(c, y, "All values are advisory. Verify them against the tool manufacturer's data "
                + "and start conservatively on a new setup.");
        c.y = y;
    }

    // ===== Drawing helpers =====

    private void writeHeader(Cursor c, String title) throws IOException {
        float y = H - 70;
        text(c, fontBold, 18, M, y, title);
        text(c, font, 10, W - 160, y + 4, "Date: " + LocalDate.now().format(DateTimeFormatter.ofPattern("dd.MM.yyyy")));
        c.y = H - 105;
    }

    private float h2(Cursor c, float y, String t) throws IOException {
        y = c.ensureSpace(y, 28);
        text(c, fontBold, 13, M, y, t);
        return y - 18;
    }

    private float kv(Cursor c, float y, String key, String value) throws IOException {
        y = c.ensureSpace(y, 18);
        text(c, font, 11, M, y, key + ":");
        text(c, fontBold, 11, M + 220, y, value);
        return y - 16;
    }

    private float paragraph(Cursor c, float y, String text) throws IOException {
        return wrappedText(c, y, text, font, 11, 16, 0);
    }

    private float codeLine(Cursor c, float y, String text) throws IOException {
        return wrappedText(c, y, text, fontMono, 10, 15, 14);
    }

    private float wrappedText(Cursor c, float y, String text, PDFont f, int size, float leading, float indent) throws IOException {
        y = c.ensureSpace(y, leading + 6);

        String[] words = winAnsi(text).split("\\s+");
        StringBuilder line = new StringBuilder();

        float x0 = M + indent;
        float maxW = MAX_WIDTH - indent;

        for (String word : words) {
            String test = (line.length() == 0) ? word : (line + " " + word);
            float tw = f.getStringWidth(test) / 1000f * size;

            if (tw > maxW && line.length() > 0) {
                y = c.ensureSpace(y, leading);
                text(c, f, size, x0, y, line.toString());
                y -= leading;
                line = new StringBuilder(word);
            } else {
                if (line.length() > 0) line.append(" ");
                line.append(word);
            }
        }

        if (line.length() > 0) {
            y = c.ensureSpace(y, leading);
            text(c, f, size, x0, y, line.toString());
            y -= leading;
        }

        return y - 4;
    }

    private void text(Cursor c, PDFont f, int size, float x, float y, String t) throws IOException {
        c.cs.beginText();
        c.cs.setFont(f, size);
        c.cs.newLineAtOffset(x, y);
        c.cs.showText(winAnsi(t));
        c.cs.endText();
    }

    /** Standard 14 fonts only encode WinAnsi; characters outside it become '?'. */
    static String winAnsi(String s) {
        if (s == null) return "-";
        GlyphList glyphs = GlyphList.getAdobeGlyphList();
        StringBuilder sb = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> {
            boolean encodable = cp >= 0x20 && WinAnsiEncoding.INSTANCE.contains(glyphs.codePointToName(cp));
            sb.append(encodable ? new String(Character.toChars(cp)) : "?");
        });
        return sb.toString();
    }

    // ===== Formatting =====

    private static double nz(Double v) {
        return v == null ? 0.0 : v;
    }

    private static String fmt(Double v) {
        if (v == null) return "-";
        return String.format(Locale.US, "%.2f", v);
    }

    private static String fmt0(Double v) {
        if (v == null) return "-";
        return String.format(Locale.US, "%,.0f", v);
    }

    private static String fmt4(Double v) {
        if (v == null) return "-";
        return String.format(Locale.US, "%.4f", v);
    }

    // ===== Cursor / pagination =====

    private static class Cursor {
        final PDDocument doc;
        PDPage page;
        PDPageContentStream cs;
        float y;

        Cursor(PDDocument doc) throws IOException {
            this.doc = doc;
            newPage();
        }

        void newPage() throws IOException {
            if (cs != null) cs.close();
            page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            cs = new PDPageContentStream(doc, page);
            y = H - 105;
        }

        void close() throws IOException {
            if (cs != null) {
                cs.close();
                cs = null;
            }
        }

        float ensureSpace(float currentY, float needed) throws IOException {
            if (currentY - needed < M) {
                newPage();
                return H - 105;
            }
            return currentY;
        }
    }
}
