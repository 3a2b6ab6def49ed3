package com.plang.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing PLang-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String EXECUTION_ID = "executionId";
    public static final String TENANT_ID = "tenantId";
    public static final String STAGE = "stage";
    public static final String POLICY = "policy";

    private MdcContext() {}

    public static void setExecution(String executionId, String tenantId) {
        MDC.put(EXECUTION_ID, executionId);
        if (tenantId != null) {
            MDC.put(TENANT_ID, tenantId);
        }
    }

    public static void setStage(String executionId, int stageIndex) {
        MDC.put(EXECUTION_ID, executionId);
        MDC.put(STAGE, String.valueOf(stageIndex));
    }

    public static void setPolicy(String executionId, int stageIndex, String policy) {
        setStage(executionId, stageIndex);
        MDC.put(POLICY, policy);
    }

    public static void setTenant(String tenantId) {
        if (tenantId != null) {
            MDC.put(TENANT_ID, tenantId);
        }
    }

    public static void clearPolicy() {
        MDC.remove(POLICY);
    }

    public static void clear() {
        MDC.remove(EXECUTION_ID);
        MDC.remove(TENANT_ID);
        MDC.remove(STAGE);
        MDC.remove(POLICY);
    }
}
