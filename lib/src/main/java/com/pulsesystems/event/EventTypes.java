package com.pulsesystems.event;

/**
 * Well-known event type tags. Event types are open strings; these are the ones the kernel itself
 * and its usual collaborators emit.
 */
public final class EventTypes {

    /** Matches every event type when used as a handler filter. */
    public static final String ALL = "*";

    public static final String KERNEL_INIT = "kernel:init";
    public static final String KERNEL_STATE_CHANGE = "kernel:state_change";
    public static final String KERNEL_SHUTDOWN = "kernel:shutdown";

    public static final String TASK_CREATE = "task:create";
    public static final String TASK_START = "task:start";
    public static final String TASK_COMPLETE = "task:complete";
    public static final String TASK_FAIL = "task:fail";
    public static final String TASK_CANCEL = "task:cancel";

    public static final String MODULE_LOAD = "module:load";
    public static final String MODULE_UNLOAD = "module:unload";
    public static final String MODULE_ERROR = "module:error";

    public static final String AGENT_SPAWN = "agent:spawn";
    public static final String AGENT_HEARTBEAT = "agent:heartbeat";
    public static final String AGENT_ERROR = "agent:error";

    public static final String MODEL_REQUEST = "model:request";
    public static final String MODEL_RESPONSE = "model:response";

    public static final String SECURITY_PERMISSION_REQUEST = "security:permission_request";
    public static final String SECURITY_VIOLATION = "security:violation";

    public static final String RECOVERY_FAILURE = "recovery:failure";
    public static final String RECOVERY_RESTORE = "recovery:restore";

    public static final String USER_COMMAND = "user:command";
    public static final String SYSTEM_ALERT = "system:alert";

    private EventTypes() {
    }
}
