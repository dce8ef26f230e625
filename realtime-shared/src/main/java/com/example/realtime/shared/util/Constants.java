package com.example.realtime.shared.util;

public final class Constants {

    private Constants() {}

    public static final String UNKNOWN_USER_NAME = "Unknown User";

    /**
     * Action names carried in the {@code action} field of inbound control frames and outbound envelopes.
     */
    public static final class Actions {
        private Actions() {}

        public static final String PING = "ping";
        public static final String PONG = "pong";
        public static final String JOIN_DISCUSSION = "join_discussion";
        public static final String JOINED_DISCUSSION = "joined_discussion";
        public static final String LEAVE_DISCUSSION = "leave_discussion";
        public static final String LEFT_DISCUSSION = "left_discussion";
        public static final String BROADCAST_POST = "broadcast_post";
        public static final String TYPING_START = "typing_start";
        public static final String TYPING_STOP = "typing_stop";
        public static final String SYNC_REQUEST = "sync_request";
        public static final String SYNC_RESPONSE = "sync_response";
        public static final String ERROR = "error";
        public static final String SERVER_SHUTDOWN = "server_shutdown";

        public static final String NEW_POST = "new_post";
        public static final String POST_UPDATED = "post_updated";
        public static final String POST_DELETED = "post_deleted";
        public static final String POST_HIDDEN = "post_hidden";
        public static final String POST_REACTION_CHANGED = "post_reaction_changed";
        public static final String POST_VISIBILITY_CHANGED = "post_visibility_changed";
    }

    public enum DomainEventType {
        POST_CREATED(Actions.NEW_POST),
        POST_UPDATED(Actions.POST_UPDATED),
        POST_DELETED(Actions.POST_DELETED),
        POST_HIDDEN(Actions.POST_HIDDEN),
        POST_VISIBILITY_CHANGED(Actions.POST_VISIBILITY_CHANGED),
        REACTION_CHANGED(Actions.POST_REACTION_CHANGED);

        private final String action;

        DomainEventType(String action) {
            this.action = action;
        }

        public String getAction() {
            return action;
        }
    }

    /**
     * Kind of write a CRUD handler reports after it commits.
     */
    public enum PostMutationType {
        CREATED,
        UPDATED,
        DELETED,
        REACTION_CHANGED,
        VISIBILITY_CHANGED
    }
}
