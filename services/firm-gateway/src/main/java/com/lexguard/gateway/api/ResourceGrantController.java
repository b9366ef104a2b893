package com.lexguard.gateway.api;

import com.lexguard.security.AccessLevel;
import com.lexguard.security.LexguardSecurityContext;
import com.lexguard.security.ResourceGrantService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.OptionalLong;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-resource grant administration. Only team managers of the caller's firm may use it, and only
 * for members of that firm.
 */
@RestController
@RequestMapping("/api/v1/grants")
public class ResourceGrantController {

    private final ResourceGrantService grantService;

    public ResourceGrantController(ResourceGrantService grantService) {
        this.grantService = grantService;
    }

    @PostMapping
    public GrantResponse grant(LexguardSecurityContext caller, @Valid @RequestBody GrantRequest request) {
        AccessLevel level =
                AccessLevel.fromString(request.level())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown access level: " + request.level()));
        return GrantResponse.from(
                grantService.grant(
                        caller,
                        request.resourceType(),
                        request.resourceId(),
                        request.memberId(),
                        level,
                        optionalVersion(request.expectedVersion())));
    }

    @DeleteMapping
    public ResponseEntity<Void> revoke(
            LexguardSecurityContext caller,
            @RequestParam String resourceType,
            @RequestParam String resourceId,
            @RequestParam String memberId,
            @RequestParam(required = false) Long expectedVersion) {
        return grantService
                .revoke(caller, resourceType, resourceId, memberId, optionalVersion(expectedVersion))
                .map(removed -> ResponseEntity.noContent().<Void>build())
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Lists the grants of one member ({@code memberId}) or of one resource ({@code resourceType}
     * and {@code resourceId}).
     */
    @GetMapping
    public List<GrantResponse> list(
            LexguardSecurityContext caller,
            @RequestParam(required = false) String memberId,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String resourceId) {
        if (memberId != null) {
            return grantService.listForMember(caller, memberId).stream().map(GrantResponse::from).toList();
        }
        if (resourceType == null || resourceId == null) {
            throw new IllegalArgumentException("Either memberId or resourceType and resourceId are required");
        }
        return grantService.listForResource(caller, resourceType, resourceId).stream()
                .map(GrantResponse::from)
                .toList();
    }

    private static OptionalLong optionalVersion(Long expectedVersion) {
        return expectedVersion == null ? OptionalLong.empty() : OptionalLong.of(expectedVersion);
    }
}
