package com.github.dimitryivaniuta.solar.payments.web;

import com.github.dimitryivaniuta.solar.payments.domain.ContractorPayout;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.exception.UnauthorizedException;
import com.github.dimitryivaniuta.solar.payments.service.Actor;
import com.github.dimitryivaniuta.solar.payments.service.PaymentOrchestrator;
import com.github.dimitryivaniuta.solar.payments.service.dto.InstallmentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentDetailsView;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.ReleaseCommand;
import com.github.dimitryivaniuta.solar.payments.service.dto.SelectMethodCommand;
import com.github.dimitryivaniuta.solar.payments.web.dto.AmountRequest;
import com.github.dimitryivaniuta.solar.payments.web.dto.PayFullRequest;
import com.github.dimitryivaniuta.solar.payments.web.dto.PayInstallmentRequest;
import com.github.dimitryivaniuta.solar.payments.web.dto.ReleasePaymentRequest;
import com.github.dimitryivaniuta.solar.payments.web.dto.SelectMethodRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for project payments.
 *
 * <p>Caller identity comes from headers set by the upstream gateway after authentication.</p>
 */
@RestController
@RequestMapping(value = "/api/payments", produces = MediaType.APPLICATION_JSON_VALUE)
public class PaymentsController {

    /** Authenticated user id. */
    public static final String USER_ID_HEADER = "X-User-Id";

    /** Authenticated user role. */
    public static final String USER_ROLE_HEADER = "X-User-Role";

    private final PaymentOrchestrator orchestrator;

    public PaymentsController(PaymentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/{projectId}/select-method", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaymentView> selectMethod(
            @PathVariable String projectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody SelectMethodRequest request
    ) {
        SelectMethodCommand command = new SelectMethodCommand(
                request.paymentMethod(),
                Money.ofNullable(request.totalAmount()),
                Money.ofNullable(request.downpaymentAmount()),
                request.numberOfInstallments()
        );
        return ResponseEntity.ok(orchestrator.selectPaymentMethod(projectId, actor(userId, role, authorization), command));
    }

    @PostMapping("/{projectId}/pay-full")
    public ResponseEntity<PaymentView> payFull(
            @PathVariable String projectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody(required = false) PayFullRequest request
    ) {
        Money amount = request == null ? null : Money.ofNullable(request.amount());
        return ResponseEntity.ok(orchestrator.payFull(projectId, actor(userId, role, null), amount));
    }

    @PostMapping(value = "/{projectId}/pay-downpayment", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaymentView> payDownpayment(
            @PathVariable String projectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody AmountRequest request
    ) {
        return ResponseEntity.ok(orchestrator.payDownpayment(projectId, actor(userId, role, null), Money.of(request.amount())));
    }

    @PostMapping(value = "/{projectId}/pay-installment", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InstallmentView> payInstallment(
            @PathVariable String projectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody PayInstallmentRequest request
    ) {
        return ResponseEntity.ok(orchestrator.payInstallment(projectId, actor(userId, role, null),
                request.installmentId(), Money.of(request.amount())));
    }

    @GetMapping("/{projectId}/installments")
    public ResponseEntity<List<InstallmentView>> installments(
            @PathVariable String projectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role
    ) {
        return ResponseEntity.ok(orchestrator.getInstallments(projectId, actor(userId, role, null)));
    }

    @GetMapping("/{projectId}/details")
    public ResponseEntity<PaymentDetailsView> details(
            @PathVariable String projectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role
    ) {
        return ResponseEntity.ok(orchestrator.getPaymentDetails(projectId, actor(userId, role, null)));
    }

    @PostMapping(value = "/{projectId}/release-payment", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaymentView> releasePayment(
            @PathVariable String projectId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @Valid @RequestBody ReleasePaymentRequest request
    ) {
        ContractorPayout payout = new ContractorPayout(
                request.contractorBankName(), request.contractorIban(), request.contractorAccountHolder());
        ReleaseCommand command = new ReleaseCommand(Money.of(request.amount()), request.paymentReference(), request.notes(), payout);
        return ResponseEntity.ok(orchestrator.releaseToContractor(projectId, actor(userId, role, null), command));
    }

    private static Actor actor(String userId, String role, String authorization) {
        if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
            throw new UnauthorizedException("Missing " + USER_ID_HEADER + " or " + USER_ROLE_HEADER + " header");
        }
        return new Actor(userId.trim(), role.trim(), authorization);
    }
}
