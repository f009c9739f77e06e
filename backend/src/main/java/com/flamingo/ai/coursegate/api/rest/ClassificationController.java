package com.flamingo.ai.coursegate.api.rest;

import com.flamingo.ai.coursegate.api.dto.request.ClassifyRequest;
import com.flamingo.ai.coursegate.api.dto.request.ItemRequest;
import com.flamingo.ai.coursegate.service.classification.ClassificationResult;
import com.flamingo.ai.coursegate.service.classification.ClassifierService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for batch classification. */
@RestController
@RequestMapping("/api/classification")
@RequiredArgsConstructor
public class ClassificationController {

  private final ClassifierService classifierService;

  /** Classifies a batch of items against the configured catalog. */
  @PostMapping
  public ResponseEntity<ClassificationResult> classify(
      @Valid @RequestBody ClassifyRequest request) {
    return ResponseEntity.ok(
        classifierService.classifyBatch(
            request.getItems().stream().map(ItemRequest::toItem).toList()));
  }
}
