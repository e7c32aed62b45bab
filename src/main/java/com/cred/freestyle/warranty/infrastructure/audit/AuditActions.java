package com.cred.freestyle.warranty.infrastructure.audit;

/**
 * Action and target-type names written to the audit trail.
 *
 * @author Warranty Platform Team
 */
public final class AuditActions {

    public static final String REGISTER_SERIAL = "register_serial";
    public static final String DISASSOCIATE_SERIAL = "disassociate_serial";
    public static final String BULK_ADD_SERIALS = "bulk_add_serials";
    public static final String CREATE_PRODUCT = "create_product";
    public static final String UPDATE_PRODUCT = "update_product";
    public static final String DELETE_PRODUCT = "delete_product";

    public static final String TARGET_SERIAL = "SerialNumber";
    public static final String TARGET_PRODUCT = "Product";

    public static final String SYSTEM_ACTOR = "system";

    private AuditActions() {
    }
}
