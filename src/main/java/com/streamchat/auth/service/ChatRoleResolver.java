package com.streamchat.auth.service;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.config.ChatProperties;
import com.streamchat.member.model.ChatRoles;
import com.streamchat.room.model.ChatRoom;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes the role set a connection hands to the chat engine on join. The engine trusts that
 * set as-is, so privileged roles are granted here and only here:
 * - admin: admin token
 * - broadcaster: streaming-enabled token owning the room's stream key
 * - moderator: verified user id in the room's moderator set
 * Privileged roles the client declares itself are dropped unless trust-client-roles is on.
 */
@Component
public class ChatRoleResolver {

    private final ChatProperties chatProperties;

    public ChatRoleResolver(ChatProperties chatProperties) {
        this.chatProperties = chatProperties;
    }

    /** Called with the room lock held, it reads the moderator set. */
    public Set<String> resolve(ChatRoom room, String userId, StreamIdentity identity, Collection<String> declaredRoles) {
        Set<String> roles = new LinkedHashSet<>();
        roles.add(ChatRoles.VIEWER);

        if (declaredRoles != null) {
            for (String role : declaredRoles) {
                if (role == null || role.isBlank()) {
                    continue;
                }
                if (!ChatRoles.isPrivileged(role) || chatProperties.isTrustClientRoles()) {
                    roles.add(role);
                }
            }
        }

        if (identity != null && identity.getUserId().equals(userId)) {
            if (identity.isAdmin()) {
                roles.add(ChatRoles.ADMIN);
            }
            if (room.getStreamKey() != null && identity.ownsStream(room.getStreamKey())) {
                roles.add(ChatRoles.BROADCASTER);
            }
            if (room.getModeratorIds().contains(userId)) {
                roles.add(ChatRoles.MODERATOR);
            }
        }
        return roles;
    }
}
