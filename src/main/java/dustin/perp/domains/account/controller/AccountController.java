package dustin.perp.domains.account.controller;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.perp.domains.account.model.dto.AccountBalanceResponse;
import dustin.perp.domains.account.model.dto.AccountTransferRequest;
import dustin.perp.domains.account.service.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 사용자 계정 컨트롤러
 * Account Controller
 *
 * API 엔드포인트:
 * - POST /api/perp/accounts - 계정 개설
 * - GET  /api/perp/accounts/me - 잔고 조회
 * - POST /api/perp/accounts/deposit - 입금
 * - POST /api/perp/accounts/withdraw - 출금
 */
@RestController
@RequestMapping("/api/perp/accounts")
@RequiredArgsConstructor
@Tag(name = "Account", description = "사용자 계정 API")
public class AccountController {

    private final AccountService accountService;

    @Operation(summary = "계정 개설", description = "이미 계정이 있으면 현재 잔고를 반환합니다.")
    @PostMapping
    public ResponseEntity<AccountBalanceResponse> openAccount(@RequestHeader("X-User-Id") String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.openAccount(userId));
    }

    @Operation(summary = "잔고 조회")
    @GetMapping("/me")
    public ResponseEntity<AccountBalanceResponse> getBalances(@RequestHeader("X-User-Id") String userId) {
        return ResponseEntity.ok(accountService.getBalances(userId));
    }

    @Operation(summary = "입금")
    @PostMapping("/deposit")
    public ResponseEntity<AccountBalanceResponse> deposit(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody AccountTransferRequest request) {
        return ResponseEntity.ok(accountService.deposit(userId, request));
    }

    @Operation(summary = "출금")
    @PostMapping("/withdraw")
    public ResponseEntity<AccountBalanceResponse> withdraw(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody AccountTransferRequest request) {
        return ResponseEntity.ok(accountService.withdraw(userId, request));
    }
}
