package com.crewlife.booking.controller;

import com.crewlife.booking.config.TraceIdFilter;
import com.crewlife.booking.dto.ConfirmAccessRequest;
import com.crewlife.booking.dto.RequestOtpRequest;
import com.crewlife.booking.dto.VerifyOtpRequest;
import com.crewlife.booking.service.CandidateAccessService;
import com.crewlife.booking.service.CandidateViews.RequestOtpCommand;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Candidate access", description = "Signed invitation, code verification and one-time booking access")
public class CandidateAccessController extends BaseController {

    private final CandidateAccessService candidateAccessService;

    @Autowired
    public CandidateAccessController(CandidateAccessService candidateAccessService) {
        this.candidateAccessService = candidateAccessService;
    }

    @GetMapping("/invite")
    @Operation(summary = "Check an invitation link",
               description = "Validates the signed link before the code request page is shown")
    public ResponseEntity<Object> openInvite(@RequestParam String brand,
                                             @RequestParam(name = "e", required = false) String email,
                                             @RequestParam(name = "t", required = false) String textForEmail,
                                             @RequestParam Long ts,
                                             @RequestParam String sig) {
        return respond(candidateAccessService.openRequestPage(brand, email, textForEmail, ts, sig));
    }

    @PostMapping("/invite/otp")
    @Operation(summary = "Request a verification code",
               description = "Emails a one-time code; returns the reference the code is verified against")
    public ResponseEntity<Object> requestOtp(@Valid @RequestBody RequestOtpRequest request,
                                             HttpServletRequest httpRequest) {
        RequestOtpCommand command = new RequestOtpCommand(request.getBrand(), request.getEmail(),
            request.getTextForEmail(), request.getTs(), request.getSig());
        String traceId = (String) httpRequest.getAttribute(TraceIdFilter.REQUEST_ATTRIBUTE);
        return respond(candidateAccessService.requestOtp(command, traceId));
    }

    @PostMapping("/invite/verify")
    @Operation(summary = "Verify a code", description = "On success the access link is emailed to the candidate")
    public ResponseEntity<Object> verifyOtp(@Valid @RequestBody VerifyOtpRequest request) {
        return respond(candidateAccessService.verifyOtp(request.getIdentityRef(), request.getOtp()));
    }

    @GetMapping("/access")
    @Operation(summary = "Open the access page",
               description = "Read-only; confirms the token without revealing the booking destination")
    public ResponseEntity<Object> openAccess(@RequestParam String token,
                                             @RequestParam(required = false) String brand) {
        return respond(candidateAccessService.openAccessPage(token, brand));
    }

    @PostMapping("/access/confirm")
    @Operation(summary = "Confirm access",
               description = "Spends the token and returns the booking URL for a client-side redirect")
    public ResponseEntity<Object> confirmAccess(@Valid @RequestBody ConfirmAccessRequest request) {
        return respond(candidateAccessService.confirmAccess(request.getToken()));
    }
}
