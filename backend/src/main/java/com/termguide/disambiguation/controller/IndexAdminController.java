package com.termguide.disambiguation.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.termguide.disambiguation.dto.guidance.UncertainMatch;
import com.termguide.disambiguation.dto.index.EngineStats;
import com.termguide.disambiguation.dto.index.IndexStats;
import com.termguide.disambiguation.dto.index.ValidationReport;
import com.termguide.disambiguation.service.guidance.GuidanceService;
import com.termguide.disambiguation.service.guidance.IndexValidationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Tag(name = "Index Administration", description = "Build, inspect and validate the guidance index")
public class IndexAdminController {

  private final GuidanceService guidanceService;
  private final IndexValidationService validationService;

  @PostMapping("/build")
  @Operation(
      summary = "Build the index",
      description =
          "Loads the corpus and builds a fresh collection, swapping it in when complete. Without "
              + "forceRebuild an already populated index is kept")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Index statistics",
            content = @Content(schema = @Schema(implementation = IndexStats.class))),
        @ApiResponse(responseCode = "422", description = "Malformed corpus"),
        @ApiResponse(responseCode = "503", description = "Embedder or vector store unavailable")
      })
  public ResponseEntity<IndexStats> build(
      @RequestParam(name = "forceRebuild", defaultValue = "false") boolean forceRebuild) {
    log.info("Index build requested (forceRebuild={})", forceRebuild);
    return ResponseEntity.ok(guidanceService.buildIndex(forceRebuild));
  }

  @GetMapping("/stats")
  @Operation(summary = "Engine statistics")
  public ResponseEntity<EngineStats> stats() {
    return ResponseEntity.ok(guidanceService.getStats());
  }

  @DeleteMapping
  @Operation(summary = "Clear the index", description = "Queries return 503 until the next build")
  @ApiResponses(value = {@ApiResponse(responseCode = "204", description = "Index cleared")})
  public ResponseEntity<Void> clear() {
    log.info("Index clear requested");
    guidanceService.clearIndex();
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/validate")
  @Operation(
      summary = "Validate the index",
      description = "Replays the configured validation cases and reports the success rate")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Validation report"),
        @ApiResponse(responseCode = "503", description = "Index not built yet")
      })
  public ResponseEntity<ValidationReport> validate() {
    return ResponseEntity.ok(validationService.validateIndex());
  }

  @GetMapping("/uncertain-matches")
  @Operation(
      summary = "Recent uncertain matches",
      description = "LOG-tier lookups kept for review, newest last")
  public ResponseEntity<List<UncertainMatch>> uncertainMatches(
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return ResponseEntity.ok(guidanceService.uncertainMatches(limit));
  }
}
