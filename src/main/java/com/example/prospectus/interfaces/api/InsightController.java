package com.example.prospectus.interfaces.api;

import com.example.prospectus.application.service.DocumentService;
import com.example.prospectus.application.service.InsightAssembler;
import com.example.prospectus.domain.model.AnalysisResult;
import com.example.prospectus.domain.model.StoredDocument;
import com.example.prospectus.domain.model.SummaryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * JSON endpoints for uploading prospectuses and reading their insight.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class InsightController {

    private static final Logger log = LoggerFactory.getLogger(InsightController.class);

    private final DocumentService documentService;
    private final InsightAssembler insightAssembler;

    public InsightController(DocumentService documentService, InsightAssembler insightAssembler) {
        this.documentService = documentService;
        this.insightAssembler = insightAssembler;
    }

    /**
     * Stores an uploaded PDF. Analysis runs lazily on the first read.
     *
     * @param file uploaded prospectus
     * @return identifier to use with the analysis endpoints
     */
    @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentReceipt> upload(@RequestParam("file") MultipartFile file) {
        StoredDocument document = documentService.submitDocument(file);
        log.info("Stored {} as {} ({} bytes)", document.fileName(), document.fileId(), document.sizeBytes());
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentReceipt.from(document));
    }

    @GetMapping("/analysis/{fileId}")
    public ResponseEntity<AnalysisResult> analysis(@PathVariable String fileId) {
        return ResponseEntity.ok(insightAssembler.analyze(fileId));
    }

    @GetMapping("/analysis/{fileId}/summary")
    public ResponseEntity<SummaryResult> summary(@PathVariable String fileId) {
        return ResponseEntity.ok(insightAssembler.getSummary(fileId));
    }

    @DeleteMapping("/documents/{fileId}")
    public ResponseEntity<Void> delete(@PathVariable String fileId) {
        documentService.deleteDocument(fileId);
        return ResponseEntity.noContent().build();
    }
}
