package com.termguide.disambiguation.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.termguide.disambiguation.dto.guidance.BulkGuidanceReport;
import com.termguide.disambiguation.dto.guidance.BulkGuidanceRequest;
import com.termguide.disambiguation.dto.guidance.FormatPromptRequest;
import com.termguide.disambiguation.dto.guidance.FormatPromptResponse;
import com.termguide.disambiguation.dto.guidance.GuidanceQueryRequest;
import com.termguide.disambiguation.dto.guidance.GuidanceResult;
import com.termguide.disambiguation.service.guidance.GuidanceService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/guidance")
@RequiredArgsConstructor
@Tag(name = "Guidance", description = "Term disambiguation lookups and prompt formatting")
public class GuidanceController {

  private final GuidanceService guidanceService;

  @PostMapping(
      value = "/query",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Look up one term",
      description =
          "Resolves a term by direct lookup, then vector similarity with negative-anchor "
              + "penalties, then sub-unit aggregation")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Guidance result; IGNORE tier when nothing matched",
            content = @Content(schema = @Schema(implementation = GuidanceResult.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "409", description = "Embedding model mismatch"),
        @ApiResponse(responseCode = "503", description = "Index not built yet")
      })
  public ResponseEntity<GuidanceResult> query(@Valid @RequestBody GuidanceQueryRequest request) {
    log.debug("Guidance query for '{}' (genre {})", request.getTerm(), request.getGenre());
    return ResponseEntity.ok(guidanceService.queryOne(request.toQuery()));
  }

  @PostMapping(
      value = "/bulk",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Look up a batch of terms",
      description =
          "Resolves every term under a ceiling on embedding calls. Terms past the ceiling are "
              + "reported as not found. A sessionId keeps the result cache across calls")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Report with per-term results and lookup statistics",
            content = @Content(schema = @Schema(implementation = BulkGuidanceReport.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "503", description = "Index not built yet")
      })
  public ResponseEntity<BulkGuidanceReport> bulk(@Valid @RequestBody BulkGuidanceRequest request) {
    log.info(
        "Bulk guidance request: {} terms, genre {}, session {}",
        request.getTerms().size(),
        request.getGenre(),
        request.getSessionId());
    return ResponseEntity.ok(
        guidanceService.queryBulk(
            request.getTerms(),
            request.getGenre(),
            request.getContext(),
            request.getMaxApiCalls(),
            request.getMinConfidence(),
            request.getSessionId()));
  }

  @PostMapping(
      value = "/format",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Render prompt guidance",
      description = "Looks the terms up and renders confident results as a markdown block")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Rendered guidance block"),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "503", description = "Index not built yet")
      })
  public ResponseEntity<FormatPromptResponse> format(
      @Valid @RequestBody FormatPromptRequest request) {
    return ResponseEntity.ok(
        guidanceService.formatForPrompt(
            request.getTerms(),
            request.getGenre(),
            request.isIncludeSuggestions(),
            request.getMaxApiCalls(),
            request.getSessionId()));
  }

  @DeleteMapping("/sessions/{sessionId}")
  @Operation(summary = "Drop a session", description = "Discards a session's cached results")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Session dropped"),
        @ApiResponse(responseCode = "404", description = "Unknown session")
      })
  public ResponseEntity<Void> dropSession(@PathVariable String sessionId) {
    guidanceService.dropSession(sessionId);
    return ResponseEntity.noContent().build();
  }
}
