package com.example.support.websocket;

import java.io.Serializable;
import java.time.Instant;

public class SessionBinding implements Serializable {

    public enum Role {
        USER,
        BOT,
        STAFF
    }

    private String sessionId;
    private Role role;
    private String identity;
    private String displayName;
    private String groupId;
    private Instant connectedAt;

    public SessionBinding() {}

    private SessionBinding(
            String sessionId, Role role, String identity, String displayName, String groupId, Instant connectedAt) {
        this.sessionId = sessionId;
        this.role = role;
        this.identity = identity;
        this.displayName = displayName;
        this.groupId = groupId;
        this.connectedAt = connectedAt;
    }

    public static SessionBinding participant(
            String sessionId, Role role, String identity, String displayName, Instant connectedAt) {
        return new SessionBinding(sessionId, role, identity, displayName, null, connectedAt);
    }

    public static SessionBinding staff(
            String sessionId, String identity, String displayName, String groupId, Instant connectedAt) {
        return new SessionBinding(sessionId, Role.STAFF, identity, displayName, groupId, connectedAt);
    }

    public String room() {
        return role == Role.STAFF
                ? SocketIoSupportTransport.staffRoom(groupId)
                : SocketIoSupportTransport.userRoom(identity);
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public void setConnectedAt(Instant connectedAt) {
        this.connectedAt = connectedAt;
    }
}
