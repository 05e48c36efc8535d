package com.crewlife.booking.controller;

import com.crewlife.booking.dto.ActorRequest;
import com.crewlife.booking.dto.CandidateInviteRequest;
import com.crewlife.booking.service.AdminInviteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Recruiter and administrator endpoints. Guarded by {@code AdminApiKeyFilter}.
 */
@RestController
@RequestMapping("/admin")
@Tag(name = "Invite administration", description = "Signed links, revocation, unlock overrides and history")
@SecurityRequirement(name = "adminApiKey")
public class AdminInviteController extends BaseController {

    private final AdminInviteService adminInviteService;

    @Autowired
    public AdminInviteController(AdminInviteService adminInviteService) {
        this.adminInviteService = adminInviteService;
    }

    @PostMapping("/links")
    @Operation(summary = "Create a signed invitation link")
    public ResponseEntity<Object> createLink(@Valid @RequestBody CandidateInviteRequest request) {
        return respond(adminInviteService.createSignedLink(
            request.getBrand(), request.getEmail(), request.getTextForEmail(), request.getActor()));
    }

    @PostMapping("/invites/revoke")
    @Operation(summary = "Revoke outstanding access tokens",
               description = "Omit textForEmail to revoke every position of the brand")
    public ResponseEntity<Object> revoke(@Valid @RequestBody CandidateInviteRequest request) {
        return respond(adminInviteService.revoke(
            request.getBrand(), request.getEmail(), request.getTextForEmail(), request.getActor()));
    }

    @PostMapping("/invites/unlock")
    @Operation(summary = "Re-open a completed or locked invite", description = "Audited; requires a reason")
    public ResponseEntity<Object> unlock(@Valid @RequestBody CandidateInviteRequest request) {
        return respond(adminInviteService.unlock(request.getBrand(), request.getEmail(),
            request.getTextForEmail(), request.getActor(), request.getReason()));
    }

    @GetMapping("/invites/history")
    @Operation(summary = "List a candidate's invite rows", description = "Never includes tokens or codes")
    public ResponseEntity<Object> history(@RequestParam String brand, @RequestParam String email) {
        return respond(adminInviteService.history(brand, email));
    }

    @PostMapping("/signing-secret/rotate")
    @Operation(summary = "Rotate the link signing secret", description = "Invalidates every outstanding link")
    public ResponseEntity<Object> rotateSecret(@Valid @RequestBody ActorRequest request) {
        return respond(adminInviteService.rotateSigningSecret(request.getActor()));
    }
}
