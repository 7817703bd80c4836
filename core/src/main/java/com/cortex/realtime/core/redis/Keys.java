package com.cortex.realtime.core.redis;

import com.cortex.realtime.core.model.ChannelType;

/**
 * Redis keyspace shared with the services that own workspaces and conversations.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefix {@code rtc:} to avoid collisions</li>
 *   <li>Presence counts of a node are only reported while its {@link #nodes()} heartbeat is fresh</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Node liveness: {@code rtc:nodes}
     * <p>
     * <b>Type:</b> Hash, field = nodeId, value = last heartbeat (epoch millis).
     * </p>
     */
    public static String nodes() {
        return "rtc:nodes";
    }

    /**
     * Open connections of one node: {@code rtc:presence:{nodeId}}
     * <p>
     * <b>Type:</b> Hash, field = channel type wire name, value = connection count.
     * </p>
     */
    public static String presence(String nodeId) {
        return "rtc:presence:" + nodeId;
    }

    public static String presenceField(ChannelType channelType) {
        return channelType.wireName();
    }

    /**
     * Workspace members: {@code rtc:ws:{workspaceId}:members}
     * <p>
     * <b>Type:</b> Set of user ids. Maintained by the workspace service.
     * </p>
     */
    public static String workspaceMembers(String workspaceId) {
        return "rtc:ws:" + workspaceId + ":members";
    }

    /**
     * Owning workspace of a conversation: {@code rtc:conv:{conversationId}:workspace}
     * <p>
     * <b>Type:</b> String (workspace id). Maintained by the conversation service.
     * </p>
     */
    public static String conversationWorkspace(String conversationId) {
        return "rtc:conv:" + conversationId + ":workspace";
    }
}
