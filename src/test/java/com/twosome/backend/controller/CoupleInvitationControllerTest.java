package com.twosome.backend.controller;

import com.google.firebase.auth.FirebaseToken;
import com.twosome.backend.exception.ConflictException;
import com.twosome.backend.exception.ForbiddenException;
import com.twosome.backend.exception.GlobalExceptionHandler;
import com.twosome.backend.exception.InvitationExpiredException;
import com.twosome.backend.exception.NotFoundException;
import com.twosome.backend.exception.PairingInvariantException;
import com.twosome.backend.model.Couple;
import com.twosome.backend.model.CoupleInvitation;
import com.twosome.backend.model.InvitationOutcome;
import com.twosome.backend.service.CoupleInvitationService;
import com.twosome.backend.service.PairingService;
import com.twosome.backend.service.UserCache;
import com.twosome.backend.service.UserService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("CoupleInvitationController")
class CoupleInvitationControllerTest {

    private static final LocalDate ANNIVERSARY = LocalDate.of(2020, 1, 1);
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 15, 10, 0);

    @Mock
    private CoupleInvitationService invitationService;

    @Mock
    private PairingService pairingService;

    @Mock
    private UserService userService;

    @Mock
    private UserCache userCache;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CoupleInvitationController controller =
                new CoupleInvitationController(invitationService, pairingService, userService, userCache);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private void signInAs(String uid, Long userId) {
        FirebaseToken token = mock(FirebaseToken.class);
        given(token.getUid()).willReturn(uid);
        given(userCache.getUserId(uid)).willReturn(userId);
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(token, null, List.of()));
    }

    private static CoupleInvitation pendingInvitation(Long id) {
        CoupleInvitation invitation = CoupleInvitation.pending(1L, 2L, ANNIVERSARY, "hi", NOW, NOW.plusDays(7));
        invitation.setId(id);
        return invitation;
    }

    @Test
    @DisplayName("requests without a signed-in user are refused")
    void anonymousRequestIsForbidden() throws Exception {
        mockMvc.perform(get("/api/couples/invitations/received"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(invitationService, userCache);
    }

    @Test
    @DisplayName("POST sends by email and answers 201")
    void sendByEmail() throws Exception {
        signInAs("uid-alice", 1L);
        given(invitationService.send(1L, "bob@example.com", ANNIVERSARY, "hi")).willReturn(pendingInvitation(7L));

        mockMvc.perform(post("/api/couples/invitations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiverEmail\":\"bob@example.com\",\"anniversaryDate\":\"2020-01-01\",\"message\":\"hi\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("POST accepts the date part of an ISO date-time")
    void sendByAccountWithDateTime() throws Exception {
        signInAs("uid-alice", 1L);
        given(invitationService.sendToAccount(1L, 2L, ANNIVERSARY, null)).willReturn(pendingInvitation(7L));

        mockMvc.perform(post("/api/couples/invitations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiverId\":2,\"anniversaryDate\":\"2020-01-01T00:00:00.000Z\"}"))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("POST without a receiver is a bad request")
    void sendWithoutReceiver() throws Exception {
        signInAs("uid-alice", 1L);

        mockMvc.perform(post("/api/couples/invitations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"anniversaryDate\":\"2020-01-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    @DisplayName("POST with a malformed date is a bad request")
    void sendWithMalformedDate() throws Exception {
        signInAs("uid-alice", 1L);

        mockMvc.perform(post("/api/couples/invitations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiverId\":2,\"anniversaryDate\":\"01/01/2020\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(invitationService);
    }

    @Test
    @DisplayName("POST for an already paired account is a conflict")
    void sendConflict() throws Exception {
        signInAs("uid-alice", 1L);
        given(invitationService.sendToAccount(1L, 2L, ANNIVERSARY, null))
                .willThrow(new ConflictException("The receiver is already in a couple"));

        mockMvc.perform(post("/api/couples/invitations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiverId\":2,\"anniversaryDate\":\"2020-01-01\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"))
                .andExpect(jsonPath("$.message").value("The receiver is already in a couple"));
    }

    @Test
    @DisplayName("GET of an unknown invitation is not found")
    void getUnknownInvitation() throws Exception {
        signInAs("uid-alice", 1L);
        given(invitationService.getForParticipant(99L, 1L)).willThrow(new NotFoundException("Invitation not found"));

        mockMvc.perform(get("/api/couples/invitations/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("PATCH accept returns the invitation and the new couple")
    void acceptReturnsCouple() throws Exception {
        signInAs("uid-bob", 2L);
        CoupleInvitation accepted = pendingInvitation(7L);
        accepted.markAccepted(NOW);
        Couple couple = Couple.builder()
                .id(40L)
                .memberIds(new LinkedHashSet<>(List.of(1L, 2L)))
                .pairingCode("AB12CD34")
                .anniversaryDate(ANNIVERSARY)
                .status(Couple.Status.ACTIVE)
                .settings(Couple.defaultSettings())
                .build();
        given(pairingService.respond(7L, 2L, CoupleInvitation.Action.ACCEPT))
                .willReturn(new InvitationOutcome(accepted, couple));

        mockMvc.perform(patch("/api/couples/invitations/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"accept\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invitation.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.couple.id").value(40))
                .andExpect(jsonPath("$.couple.pairingCode").value("AB12CD34"));
    }

    @Test
    @DisplayName("PATCH with an unknown action is a bad request")
    void unknownAction() throws Exception {
        signInAs("uid-bob", 2L);

        mockMvc.perform(patch("/api/couples/invitations/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"maybe\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(pairingService);
    }

    @Test
    @DisplayName("PATCH on a lapsed invitation answers 410")
    void expiredInvitation() throws Exception {
        signInAs("uid-bob", 2L);
        given(pairingService.respond(eq(7L), eq(2L), any())).willThrow(new InvitationExpiredException(7L));

        mockMvc.perform(patch("/api/couples/invitations/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"accept\"}"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.error").value("EXPIRED"));
    }

    @Test
    @DisplayName("PATCH by someone other than the receiver is forbidden")
    void forbiddenResponder() throws Exception {
        signInAs("uid-carol", 3L);
        given(pairingService.respond(7L, 3L, CoupleInvitation.Action.REJECT))
                .willThrow(new ForbiddenException("Only the receiver can reject this invitation"));

        mockMvc.perform(patch("/api/couples/invitations/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"reject\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("a broken pairing invariant answers 500 without details")
    void fatalIsHidden() throws Exception {
        signInAs("uid-bob", 2L);
        given(pairingService.respond(7L, 2L, CoupleInvitation.Action.ACCEPT))
                .willThrow(new PairingInvariantException("Couple 40 lists members [1, 2] but is referenced by accounts [2]"));

        mockMvc.perform(patch("/api/couples/invitations/7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"accept\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Something went wrong. Please try again later."));
    }
}
