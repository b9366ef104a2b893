package com.lexguard.security;

import java.util.Optional;

/**
 * Boolean capabilities that sit outside the module/level grid.
 */
public enum SpecialPermission {

    CAN_APPROVE_INVOICES("canApproveInvoices"),
    CAN_MANAGE_RETAINERS("canManageRetainers"),
    CAN_EXPORT_DATA("canExportData"),
    CAN_DELETE_RECORDS("canDeleteRecords"),
    CAN_VIEW_FINANCE("canViewFinance"),
    CAN_MANAGE_TEAM("canManageTeam"),
    CAN_INVITE_MEMBERS("canInviteMembers"),
    CAN_MANAGE_BILLING("canManageBilling"),
    CAN_ACCESS_REPORTS("canAccessReports");

    private final String value;

    SpecialPermission(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SpecialPermission> fromString(String value) {
        for (SpecialPermission flag : values()) {
            if (flag.value.equals(value)) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }
}
