package com.openforge.lexguard.moderation.gate;

import com.openforge.lexguard.auth.CurrentUser;
import com.openforge.lexguard.domain.Suspension;
import com.openforge.lexguard.moderation.account.AccountStatusStore;
import com.openforge.lexguard.moderation.appeal.AppealWorkflow;
import com.openforge.lexguard.moderation.dto.AccountStatusResponse;
import com.openforge.lexguard.moderation.dto.SuspensionResponse;
import com.openforge.lexguard.moderation.suspension.SuspensionLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Caller-scoped moderation reads.
 *
 *   GET /api/moderation/can-post         may I post right now?
 *   GET /api/user/moderation-status      strikes, suspensions, status
 *   GET /api/user/suspension/current     active suspension and whether it can be appealed
 */
@RestController
@RequiredArgsConstructor
public class ModerationStatusController {

    private final GateCheck          gateCheck;
    private final AccountStatusStore accounts;
    private final SuspensionLedger   ledger;
    private final AppealWorkflow     appeals;

    public record CurrentSuspensionResponse(
            boolean            suspended,
            SuspensionResponse suspension,
            boolean            appealSubmitted,
            boolean            canAppeal
    ) {}

    @GetMapping("/api/moderation/can-post")
    public GateResult canPost() {
        return gateCheck.checkCanPost(CurrentUser.id());
    }

    @GetMapping("/api/user/moderation-status")
    public AccountStatusResponse moderationStatus() {
        Long userId = CurrentUser.id();
        gateCheck.checkCanPost(userId);
        return AccountStatusResponse.from(accounts.getStatus(userId));
    }

    @GetMapping("/api/user/suspension/current")
    public CurrentSuspensionResponse currentSuspension() {
        Long userId = CurrentUser.id();
        gateCheck.checkCanPost(userId);
        Optional<Suspension> active = ledger.getActive(userId);
        if (active.isEmpty()) {
            return new CurrentSuspensionResponse(false, null, false, false);
        }
        Suspension s = active.get();
        boolean appealed = appeals.hasAppeal(s.getId());
        return new CurrentSuspensionResponse(true, SuspensionResponse.from(s), appealed, !appealed && !s.isPermanent());
    }
}
