package com.streamchat.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamchat.auth.authorization.RoomOwnerAuthorizationManager;
import com.streamchat.auth.exception.handler.JwtAccessDeniedHandler;
import com.streamchat.auth.exception.handler.JwtAuthenticationFailureHandler;
import com.streamchat.auth.filter.JwtAuthProcessorFilter;
import com.streamchat.auth.provider.IdentityProvider;
import com.streamchat.room.service.RoomRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final IdentityProvider identityProvider;
    private final RoomRegistry roomRegistry;
    private final ObjectMapper objectMapper;
    private final String chatEndpoint;

    public SecurityConfig(
        IdentityProvider identityProvider,
        RoomRegistry roomRegistry,
        ObjectMapper objectMapper,
        @Value("${streamchat.websocket.endpoint:/chat}") String chatEndpoint
    ) {
        this.identityProvider = identityProvider;
        this.roomRegistry = roomRegistry;
        this.objectMapper = objectMapper;
        this.chatEndpoint = chatEndpoint;
    }

    /* [room API] : reads are public, settings and moderator changes need the room owner or an admin */
    @Bean
    public SecurityFilterChain roomApiFilterChain(HttpSecurity http) throws Exception {
        RoomOwnerAuthorizationManager roomOwner = new RoomOwnerAuthorizationManager(roomRegistry);

        http.securityMatcher("/api/chat/**")
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.GET, "/api/chat/**").permitAll()
                .requestMatchers(HttpMethod.PUT, "/api/chat/rooms/{roomId}/**").access(roomOwner)
                .requestMatchers(HttpMethod.DELETE, "/api/chat/rooms/{roomId}/**").access(roomOwner)
                .anyRequest().authenticated())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sess -> sess.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterAt(new JwtAuthProcessorFilter(identityProvider), UsernamePasswordAuthenticationFilter.class)
            .exceptionHandling(exception ->
                exception.authenticationEntryPoint(new JwtAuthenticationFailureHandler(objectMapper))
                         .accessDeniedHandler(new JwtAccessDeniedHandler(objectMapper)));
        return http.build();
    }

    /* [chat socket] : anonymous viewers may connect, a valid token only adds identity */
    @Bean
    public SecurityFilterChain chatWebSocketFilterChain(HttpSecurity http) throws Exception {
        http.securityMatcher(chatEndpoint, chatEndpoint + "/**")
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sess -> sess.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterAt(new JwtAuthProcessorFilter(identityProvider), UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }
}
