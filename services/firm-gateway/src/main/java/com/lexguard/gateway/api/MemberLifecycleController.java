package com.lexguard.gateway.api;

import com.lexguard.security.FirmRole;
import com.lexguard.security.LexguardSecurityContext;
import com.lexguard.security.MemberLifecycle;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Membership status changes. Illegal transitions answer 409.
 */
@RestController
@RequestMapping("/api/v1/members/{memberId}")
public class MemberLifecycleController {

    private final MemberLifecycle lifecycle;

    public MemberLifecycleController(MemberLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @PostMapping("/approve")
    public MemberResponse approve(LexguardSecurityContext caller, @PathVariable String memberId) {
        return MemberResponse.from(lifecycle.approve(caller, memberId));
    }

    @PostMapping("/suspend")
    public MemberResponse suspend(LexguardSecurityContext caller, @PathVariable String memberId) {
        return MemberResponse.from(lifecycle.suspend(caller, memberId));
    }

    @PostMapping("/reinstate")
    public MemberResponse reinstate(LexguardSecurityContext caller, @PathVariable String memberId) {
        return MemberResponse.from(lifecycle.reinstate(caller, memberId));
    }

    @PostMapping("/leave")
    public MemberResponse startLeave(LexguardSecurityContext caller, @PathVariable String memberId) {
        return MemberResponse.from(lifecycle.startLeave(caller, memberId));
    }

    @PostMapping("/return")
    public MemberResponse endLeave(LexguardSecurityContext caller, @PathVariable String memberId) {
        return MemberResponse.from(lifecycle.endLeave(caller, memberId));
    }

    @PostMapping("/depart")
    public MemberResponse depart(LexguardSecurityContext caller, @PathVariable String memberId) {
        return MemberResponse.from(lifecycle.depart(caller, memberId));
    }

    @PostMapping("/rehire")
    public MemberResponse rehire(
            LexguardSecurityContext caller,
            @PathVariable String memberId,
            @Valid @RequestBody RehireRequest request) {
        FirmRole role =
                FirmRole.fromString(request.role())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + request.role()));
        return MemberResponse.from(lifecycle.rehire(caller, memberId, role));
    }

    @PostMapping("/terminate")
    public MemberResponse terminate(LexguardSecurityContext caller, @PathVariable String memberId) {
        return MemberResponse.from(lifecycle.terminate(caller, memberId));
    }
}
