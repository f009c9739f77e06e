package com.flamingo.ai.coursegate.api.rest;

import com.flamingo.ai.coursegate.api.dto.request.QuotaRequest;
import com.flamingo.ai.coursegate.service.quota.QuotaResult;
import com.flamingo.ai.coursegate.service.quota.QuotaService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for quota checks. */
@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
public class QuotaController {

  private final QuotaService quotaService;

  @PostMapping
  public ResponseEntity<QuotaResult> checkQuota(@Valid @RequestBody QuotaRequest request) {
    if (request.getSpecialItemSubTypes() != null) {
      return ResponseEntity.ok(
          quotaService.checkQuota(request.getCollectionSize(), request.getSpecialItemSubTypes()));
    }
    if (request.getSpecialItemCount() == null) {
      throw new IllegalArgumentException(
          "Either specialItemCount or specialItemSubTypes is required");
    }
    return ResponseEntity.ok(
        quotaService.checkQuota(request.getCollectionSize(), request.getSpecialItemCount()));
  }
}
