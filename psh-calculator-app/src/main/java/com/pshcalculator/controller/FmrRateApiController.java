package com.pshcalculator.controller;

import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import com.pshcalculator.service.RateTableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api/fmr-rates")
public class FmrRateApiController {

    private static final Logger log = LoggerFactory.getLogger(FmrRateApiController.class);

    private final RateTableManager rateTableManager;

    public FmrRateApiController(RateTableManager rateTableManager) {
        this.rateTableManager = rateTableManager;
    }

    @GetMapping
    public ResponseEntity<FmrRateTable> getRates() {
        return ResponseEntity.ok(rateTableManager.current());
    }

    @PutMapping
    public ResponseEntity<FmrRateTable> replaceRates(@RequestBody FmrRateTable table) {
        return ResponseEntity.ok(rateTableManager.replace(table));
    }

    @PutMapping("/{bedrooms}")
    public ResponseEntity<FmrRateTable> updateRate(@PathVariable int bedrooms, @RequestBody FmrRate rate) {
        return ResponseEntity.ok(rateTableManager.updateRate(bedrooms, rate));
    }

    @PostMapping("/reset")
    public ResponseEntity<FmrRateTable> resetRates() {
        return ResponseEntity.ok(rateTableManager.resetToDefault());
    }

    @PostMapping("/import")
    public ResponseEntity<?> importRates(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "effectiveDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate effectiveDate) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Uploaded rate file is empty"));
        }
        LocalDate effective = effectiveDate != null ? effectiveDate : LocalDate.now();
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(rateTableManager.importCsv(reader, effective));
        } catch (IOException e) {
            log.error("Failed to read uploaded rate file {}", file.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Failed to read rate file"));
        }
    }
}
