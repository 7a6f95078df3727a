package uk.gegc.questionbot.features.account.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.questionbot.features.account.api.dto.BalanceDto;
import uk.gegc.questionbot.features.account.api.dto.RegisterAccountRequest;
import uk.gegc.questionbot.features.account.application.AccountService;
import uk.gegc.questionbot.features.credit.api.dto.SpendResultDto;
import uk.gegc.questionbot.features.credit.api.dto.TopUpRequest;
import uk.gegc.questionbot.features.credit.application.CreditService;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Validated
@Tag(name = "Accounts", description = "Web application hooks for accounts and credits")
public class AccountController {

    private final AccountService accountService;
    private final CreditService creditService;

    @Operation(summary = "Register a web account", description = "Records a verified web sign-up with zero credits.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "Account created",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid or reserved email"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping
    public ResponseEntity<BalanceDto> register(@Valid @RequestBody RegisterAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.registerWebAccount(request.email()));
    }

    @Operation(summary = "Get balance by email")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance"),
            @ApiResponse(responseCode = "404", description = "No account for the email")
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalanceByEmail(
            @Parameter(description = "Account email", example = "bob@example.com")
            @RequestParam @NotBlank @Email String email
    ) {
        return ResponseEntity.ok(accountService.getBalanceByEmail(email));
    }

    @Operation(summary = "Get balance by account id")
    @GetMapping("/{accountId}")
    public ResponseEntity<BalanceDto> getBalance(@PathVariable UUID accountId) {
        return ResponseEntity.ok(accountService.getBalance(accountId));
    }

    @Operation(
            summary = "Add paid credits",
            description = "Credits confirmed out of band by the payment side. Recorded in the credit ledger."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated balance"),
            @ApiResponse(responseCode = "400", description = "Invalid amount"),
            @ApiResponse(responseCode = "404", description = "Account not found")
    })
    @PostMapping("/{accountId}/credits")
    public ResponseEntity<BalanceDto> topUp(@PathVariable UUID accountId, @Valid @RequestBody TopUpRequest request) {
        return ResponseEntity.ok(creditService.creditPaid(accountId, request.credits(), request.reference()));
    }

    @Operation(summary = "Spend one credit", description = "Web-side spend; free credits are used before paid ones.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credit spent"),
            @ApiResponse(responseCode = "404", description = "Account not found"),
            @ApiResponse(responseCode = "409", description = "No credits left")
    })
    @PostMapping("/{accountId}/spend")
    public ResponseEntity<SpendResultDto> spend(@PathVariable UUID accountId) {
        return ResponseEntity.ok(creditService.spend(accountId));
    }
}
