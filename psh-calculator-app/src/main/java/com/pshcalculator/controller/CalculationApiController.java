package com.pshcalculator.controller;

import com.pshcalculator.model.CalculationRequest;
import com.pshcalculator.model.CalculationResult;
import com.pshcalculator.model.ValidationError;
import com.pshcalculator.service.CalculationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/calculations")
public class CalculationApiController {

    private final CalculationService calculationService;

    public CalculationApiController(CalculationService calculationService) {
        this.calculationService = calculationService;
    }

    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody CalculationRequest request) {
        List<ValidationError> errors = calculationService.check(request);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("valid", errors.isEmpty());
        response.put("errors", errors);
        return ResponseEntity.ok(response);
    }

    // Validation and rate table failures are mapped by GlobalExceptionHandler
    @PostMapping
    public ResponseEntity<CalculationResult> calculate(@RequestBody CalculationRequest request) {
        return ResponseEntity.ok(calculationService.validateAndCalculate(request));
    }
}
