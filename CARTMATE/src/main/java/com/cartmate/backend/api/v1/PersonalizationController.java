package com.cartmate.backend.api.v1;

import com.cartmate.backend.api.dto.PersonalizationRequest;
import com.cartmate.backend.api.dto.PersonalizationResponse;
import com.cartmate.backend.personalization.PersonalizationProfile;
import com.cartmate.backend.personalization.PersonalizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for per-session personalization data.
 */
@RestController
@RequestMapping("/api/v1/personalization")
@Tag(name = "Personalization", description = "Style and budget preferences of a chat session")
@Slf4j
public class PersonalizationController {

    static final String NOT_FOUND = "No personalization data found for this session";

    private final PersonalizationService personalizationService;

    public PersonalizationController(PersonalizationService personalizationService) {
        this.personalizationService = personalizationService;
    }

    @PutMapping("/{sessionId}")
    @Operation(summary = "Save personalization", description = "Replace the style and budget preferences of a session")
    @ApiResponse(responseCode = "200", description = "Personalization saved")
    @ApiResponse(responseCode = "400", description = "Invalid preferences")
    @ApiResponse(responseCode = "500", description = "Preferences could not be stored")
    public Mono<ResponseEntity<PersonalizationResponse>> save(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId,
            @Valid @RequestBody PersonalizationRequest request) {
        PersonalizationProfile profile = request.toProfile(sessionId);
        log.info("Saving personalization data for session {}", sessionId);
        return personalizationService.save(sessionId, profile)
                .map(saved -> saved
                        ? ResponseEntity.ok(new PersonalizationResponse(true,
                        "Personalization data saved successfully", profile))
                        : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(new PersonalizationResponse(false, "Failed to save personalization data", null)));
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get personalization", description = "Preferences saved for a session")
    @ApiResponse(responseCode = "200", description = "Personalization found")
    @ApiResponse(responseCode = "404", description = "No personalization saved")
    public Mono<ResponseEntity<PersonalizationResponse>> get(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        return personalizationService.get(sessionId)
                .map(profile -> ResponseEntity.ok(new PersonalizationResponse(true,
                        "Personalization data retrieved successfully", profile)))
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new PersonalizationResponse(false, NOT_FOUND, null)));
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Clear personalization", description = "Delete the preferences of a session")
    @ApiResponse(responseCode = "204", description = "Personalization cleared")
    @ApiResponse(responseCode = "404", description = "No personalization saved")
    public Mono<ResponseEntity<Void>> clear(
            @Parameter(description = "Chat session ID") @PathVariable String sessionId) {
        log.info("Clearing personalization data for session {}", sessionId);
        return personalizationService.clear(sessionId)
                .map(removed -> removed
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
