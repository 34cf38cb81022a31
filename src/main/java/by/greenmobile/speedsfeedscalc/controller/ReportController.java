package by.greenmobile.speedsfeedscalc.controller;

import by.greenmobile.speedsfeedscalc.entity.CalculationRequest;
import by.greenmobile.speedsfeedscalc.entity.CalculationResult;
import by.greenmobile.speedsfeedscalc.exception.MachiningException;
import by.greenmobile.speedsfeedscalc.service.CalculationService;
import by.greenmobile.speedsfeedscalc.service.report.PdfReportService;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import static by.greenmobile.speedsfeedscalc.controller.CalcController.SESSION_LAST_RESULT;

@Controller
@RequiredArgsConstructor
public class ReportController {

    private final CalculationService calculationService;
    private final PdfReportService pdfReportService;

    @PostMapping("/report/pdf")
    public ResponseEntity<byte[]> reportPdf(@ModelAttribute CalculationRequest request) throws IOException {
        CalculationResult result;
        try {
            result = calculationService.calculate(request);
        } catch (MachiningException e) {
            return ResponseEntity.badRequest()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(e.getMessage().getBytes(StandardCharsets.UTF_8));
        }
        return pdf(pdfReportService.buildEngineeringReport(result));
    }

    @GetMapping("/export/pdf")
    public ResponseEntity<byte[]> exportPdf(HttpSession session) throws IOException {
        Object obj = session.getAttribute(SESSION_LAST_RESULT);
        if (!(obj instanceof CalculationResult last)) {
            return ResponseEntity.notFound().build();
        }
        return pdf(pdfReportService.buildEngineeringReport(last));
    }

    private ResponseEntity<byte[]> pdf(byte[] bytes) {
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));

        HttpHeaders h = new HttpHeaders();
        h.setContentDisposition(ContentDisposition.attachment()
                .filename("speeds_feeds_" + ts + ".pdf", StandardCharsets.UTF_8).build());
        h.setCacheControl("no-cache, no-store, must-revalidate");
        h.setPragma("no-cache");

        return ResponseEntity.ok()
                .headers(h)
                .contentType(MediaType.APPLICATION_PDF)
                .body(bytes);
    }
}
