package com.streamchat.auth.authorization;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.room.model.RoomState;
import com.streamchat.room.service.RoomRegistry;
import org.springframework.security.authentication.AuthenticationTrustResolver;
import org.springframework.security.authentication.AuthenticationTrustResolverImpl;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Grants room management to admins and to the owner of the stream the room is bound to.
 * The room id comes from the {@code {roomId}} path variable of the matched request.
 *
 * An unknown room is let through so the API answers 404 instead of 403.
 */
public class RoomOwnerAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    public static final String ROOM_ID_VARIABLE = "roomId";

    private final RoomRegistry roomRegistry;
    private final AuthenticationTrustResolver trustResolver = new AuthenticationTrustResolverImpl();

    public RoomOwnerAuthorizationManager(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        Authentication auth = authentication.get();
        if (auth == null || !auth.isAuthenticated() || trustResolver.isAnonymous(auth)
                || !(auth.getPrincipal() instanceof StreamIdentity identity)) {
            return new AuthorizationDecision(false);
        }
        if (hasAuthority(auth, StreamIdentity.AUTHORITY_ADMIN)) {
            return new AuthorizationDecision(true);
        }

        String roomId = context.getVariables().get(ROOM_ID_VARIABLE);
        Optional<RoomState> room = roomId == null ? Optional.empty() : roomRegistry.get(roomId);
        if (room.isEmpty()) {
            return new AuthorizationDecision(roomId != null);
        }
        String streamKey = room.get().getRoom().getStreamKey();
        return new AuthorizationDecision(streamKey != null && identity.ownsStream(streamKey));
    }

    private static boolean hasAuthority(Authentication auth, String authority) {
        for (GrantedAuthority granted : auth.getAuthorities()) {
            if (authority.equals(granted.getAuthority())) {
                return true;
            }
        }
        return false;
    }
}
