package com.payment.facilitator.api;

import com.payment.facilitator.chain.ChainGateway;
import com.payment.facilitator.chain.NetworkRegistry;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.core.SettlementCoordinator;
import com.payment.facilitator.domain.FeeEstimate;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PaymentScheme;
import com.payment.facilitator.domain.SettlementResult;
import com.payment.facilitator.domain.VerificationResult;
import com.payment.facilitator.persistence.PaymentLedger;
import com.payment.facilitator.registry.RequirementRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST surface of the facilitator: verify and settle payment authorizations, declare and
 * look up requirements, and read settlement state.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/facilitator")
@RequiredArgsConstructor
@Tag(name = "Facilitator", description = "Verify and settle signed payment authorizations")
public class FacilitatorController {

    private final SettlementCoordinator coordinator;
    private final RequirementRegistry requirementRegistry;
    private final PaymentHeaderCodec headerCodec;
    private final PaymentLedger ledger;
    private final ChainGateway chainGateway;
    private final NetworkRegistry networkRegistry;

    @Value("${facilitator.protocol-version:1}")
    private int protocolVersion;

    @PostMapping("/verify")
    @Operation(
            summary = "Verify a payment authorization",
            description = "Checks recipient, amount, validity window and signature against the requirements. "
                    + "Does not reserve the nonce; an authorization that is already being settled is reported "
                    + "as DUPLICATE_AUTHORIZATION.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Verification outcome. Check body.isValid and body.invalidReason.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = VerifyResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Malformed payment header or requirements. Body: { \"error\": ..., \"message\": ... }")
    })
    public ResponseEntity<VerifyResponseDto> verify(@Valid @RequestBody FacilitatorRequestDto dto) {
        PaymentAuthorization authorization = headerCodec.resolve(dto);
        PaymentRequirement requirement = dto.getPaymentRequirements().toDomain();
        VerificationResult result = coordinator.verify(authorization, requirement);
        log.debug("Verify completed payer={} network={} valid={} reason={}",
                authorization.getPayer(), authorization.getNetwork(), result.isValid(), result.getReason());
        return ResponseEntity.ok(VerifyResponseDto.from(result));
    }

    @PostMapping("/settle")
    @Operation(
            summary = "Settle a payment authorization",
            description = "Verifies, reserves the authorization's nonce and submits the transfer on chain. "
                    + "Idempotent: repeating the call returns the current state of the same payment and never "
                    + "submits twice. body.success is true once the transfer is SETTLED.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Settlement state. Check body.status, body.success and body.errorReason.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = SettleResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Malformed payment header or requirements."),
            @ApiResponse(responseCode = "500", description = "Settlement aborted by an internal failure; nothing was recorded, safe to retry.")
    })
    public ResponseEntity<SettleResponseDto> settle(@Valid @RequestBody FacilitatorRequestDto dto) {
        PaymentAuthorization authorization = headerCodec.resolve(dto);
        PaymentRequirement requirement = dto.getPaymentRequirements().toDomain();
        SettlementResult result = coordinator.settle(authorization, requirement);
        log.debug("Settle completed paymentId={} status={} ref={}", result.getPaymentId(), result.getStatus(), result.getTransactionRef());
        return ResponseEntity.ok(SettleResponseDto.from(result));
    }

    @GetMapping("/supported")
    @Operation(summary = "Supported payment kinds", description = "Every (scheme, network) pair this facilitator can settle.")
    public ResponseEntity<List<SupportedKindDto>> supported() {
        List<SupportedKindDto> kinds = new ArrayList<>();
        for (FacilitatorProperties.Network network : networkRegistry.all()) {
            for (PaymentScheme scheme : PaymentScheme.values()) {
                kinds.add(new SupportedKindDto(protocolVersion, scheme.wireName(), network.getName()));
            }
        }
        return ResponseEntity.ok(kinds);
    }

    @GetMapping("/payments/{paymentId}")
    @Operation(summary = "Look up a payment", description = "Current settlement state and the audited transition history.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment found",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentDetailsDto.class))),
            @ApiResponse(responseCode = "404", description = "No payment with that id")
    })
    public ResponseEntity<PaymentDetailsDto> payment(@PathVariable String paymentId) {
        return coordinator.find(paymentId)
                .map(result -> ResponseEntity.ok(new PaymentDetailsDto(result, ledger.history(paymentId))))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/requirements")
    @Operation(summary = "Declare a payment requirement",
            description = "Registers what a resource demands on one network. Re-declaring the same (resource, scheme, network) replaces it.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Requirement declared"),
            @ApiResponse(responseCode = "400", description = "Invalid requirement. Body: { \"error\": \"INVALID_REQUIREMENT\", \"message\": ... }")
    })
    public ResponseEntity<PaymentRequirementsDto> declare(@Valid @RequestBody PaymentRequirementsDto dto) {
        PaymentRequirement declared = requirementRegistry.declare(dto.toDomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentRequirementsDto.from(declared));
    }

    @GetMapping("/requirements")
    @Operation(summary = "Payment-required body for a resource",
            description = "The accepts list a resource server returns with HTTP 402, optionally filtered by network.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Requirements found",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentRequiredResponse.class))),
            @ApiResponse(responseCode = "404", description = "No requirement declared for the resource")
    })
    public ResponseEntity<PaymentRequiredResponse> requirements(@RequestParam String resource,
                                                                @RequestParam(required = false) String network) {
        List<PaymentRequirement> found = network == null
                ? requirementRegistry.lookup(resource)
                : requirementRegistry.lookup(resource, network);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(PaymentRequiredResponse.builder()
                .x402Version(protocolVersion)
                .error("X-PAYMENT header is required")
                .accepts(found.stream().map(PaymentRequirementsDto::from).collect(Collectors.toList()))
                .build());
    }

    @GetMapping("/fees")
    @Operation(summary = "Estimate settlement fee",
            description = "Facilitator's cost of settling one payment for the resource on the network, in the network's native unit.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Fee estimate",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = FeeEstimate.class))),
            @ApiResponse(responseCode = "404", description = "No requirement declared for the resource on that network"),
            @ApiResponse(responseCode = "503", description = "Chain unavailable")
    })
    public ResponseEntity<FeeEstimate> fees(@RequestParam String resource, @RequestParam String network) {
        List<PaymentRequirement> found = requirementRegistry.lookup(resource, network);
        if (found.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(chainGateway.estimateFee(found.get(0)));
    }

    @GetMapping("/networks")
    @Operation(summary = "Configured networks", description = "Networks with their confirmation thresholds and circuit breaker state.")
    public ResponseEntity<List<NetworkStatusDto>> networks() {
        List<NetworkStatusDto> statuses = networkRegistry.all().stream()
                .map(n -> NetworkStatusDto.builder()
                        .name(n.getName())
                        .family(n.getFamily())
                        .chainId(n.getChainId())
                        .requiredConfirmations(n.getRequiredConfirmations())
                        .circuitState(chainGateway.circuitState(n.getName()).name())
                        .build())
                .collect(Collectors.toList());
        return ResponseEntity.ok(statuses);
    }
}
