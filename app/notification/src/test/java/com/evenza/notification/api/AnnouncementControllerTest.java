package com.evenza.notification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.evenza.notification.api.request.CreateAnnouncementRequest;
import com.evenza.notification.api.request.SendAnnouncementRequest;
import com.evenza.notification.api.request.UpdateAnnouncementRequest;
import com.evenza.notification.api.response.AnnouncementListResponse;
import com.evenza.notification.api.response.AnnouncementSummary;
import com.evenza.notification.api.response.AnnouncementWriteResponse;
import com.evenza.notification.api.response.ClearAnnouncementsResponse;
import com.evenza.notification.api.response.DispatchResponse;
import com.evenza.notification.service.AnnouncementService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AnnouncementController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AnnouncementControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AnnouncementService announcementService;

  @Test
  void listReturnsDerivedAnnouncements() throws Exception {
    when(announcementService.list())
        .thenReturn(
            new AnnouncementListResponse(
                List.of(
                    new AnnouncementSummary(
                        11L,
                        42L,
                        "Doors open",
                        "Doors open at 7pm",
                        "Sent",
                        null,
                        Instant.parse("2026-01-16T00:00:00Z"),
                        Instant.parse("2026-01-16T00:00:00Z")))));

    mockMvc
        .perform(get("/api/announcements"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.announcements[0].announcement_id").value(11))
        .andExpect(jsonPath("$.announcements[0].event_id").value(42))
        .andExpect(jsonPath("$.announcements[0].status").value("Sent"));
  }

  @Test
  void createSentReturnsDispatchCounts() throws Exception {
    when(announcementService.create(eq(3L), any(CreateAnnouncementRequest.class)))
        .thenReturn(AnnouncementWriteResponse.dispatched(5L, new DispatchResponse(2, 2)));

    mockMvc
        .perform(
            post("/api/announcements")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"event_id":42,"title":"Reminder","message":"Doors open at 6pm","markSent":true}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.announcementId").value(5))
        .andExpect(jsonPath("$.announcement_id").doesNotExist())
        .andExpect(jsonPath("$.sent.inserted").value(2))
        .andExpect(jsonPath("$.sent.requested").value(2));

    final ArgumentCaptor<CreateAnnouncementRequest> captor =
        ArgumentCaptor.forClass(CreateAnnouncementRequest.class);
    verify(announcementService).create(eq(3L), captor.capture());
    assertThat(captor.getValue().markSent()).isTrue();
    assertThat(captor.getValue().eventId()).isEqualTo("42");
  }

  @Test
  void createAcceptsSnakeCaseMarkSentAlias() throws Exception {
    when(announcementService.create(eq(3L), any(CreateAnnouncementRequest.class)))
        .thenReturn(AnnouncementWriteResponse.dispatched(7L, new DispatchResponse(0, 0)));

    mockMvc
        .perform(
            post("/api/announcements")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"event_title":"Spring Gala","title":"T","message":"M","mark_sent":true}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.announcementId").value(7));

    final ArgumentCaptor<CreateAnnouncementRequest> captor =
        ArgumentCaptor.forClass(CreateAnnouncementRequest.class);
    verify(announcementService).create(eq(3L), captor.capture());
    assertThat(captor.getValue().markSent()).isTrue();
    assertThat(captor.getValue().eventTitle()).isEqualTo("Spring Gala");
  }

  @Test
  void createDraftOmitsSentCounts() throws Exception {
    when(announcementService.create(eq(3L), any(CreateAnnouncementRequest.class)))
        .thenReturn(AnnouncementWriteResponse.saved(6L));

    mockMvc
        .perform(
            post("/api/announcements")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"event_id":"42","title":"Draft","message":"later"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.announcementId").value(6))
        .andExpect(jsonPath("$.sent").doesNotExist());
  }

  @Test
  void createWithoutCallerIsUnauthorized() throws Exception {
    mockMvc
        .perform(
            post("/api/announcements")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"T","message":"M"}
                    """))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    verifyNoInteractions(announcementService);
  }

  @Test
  void createWithNonNumericCallerIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/announcements")
                .header("X-User-Id", "abc")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"T","message":"M"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void createWithoutTitleIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/announcements")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"message":"M"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("title is required"));
    verifyNoInteractions(announcementService);
  }

  @Test
  void createWithoutBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/announcements")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  @Test
  void updateOfSentAnnouncementIsConflict() throws Exception {
    when(announcementService.update(eq(5L), eq(3L), any(UpdateAnnouncementRequest.class)))
        .thenThrow(new InvalidAnnouncementTransitionException("announcement already sent: 5"));

    mockMvc
        .perform(
            patch("/api/announcements/5")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Changed"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("STATE_CONFLICT"));
  }

  @Test
  void updateOfUnknownAnnouncementIsNotFound() throws Exception {
    when(announcementService.update(eq(99L), anyLong(), any(UpdateAnnouncementRequest.class)))
        .thenThrow(new AnnouncementNotFoundException(99L));

    mockMvc
        .perform(
            patch("/api/announcements/99")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status":"sent"}
                    """))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void sendNowFailureIsReportedAsDispatchError() throws Exception {
    when(announcementService.sendNow(eq(3L), any(SendAnnouncementRequest.class)))
        .thenThrow(
            new AnnouncementDispatchException(
                "failed to write notifications for announcement 5", new IllegalStateException()));

    mockMvc
        .perform(
            post("/api/announcements/send")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"event_id":"42","title":"T","message":"M"}
                    """))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("DISPATCH_FAILED"));
  }

  @Test
  void sendNowHonoursMarkSentFalse() throws Exception {
    when(announcementService.sendNow(eq(3L), any(SendAnnouncementRequest.class)))
        .thenReturn(new DispatchResponse(1, 1));

    mockMvc
        .perform(
            post("/api/announcements/send")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"event_id":"42","title":"T","message":"M","markSent":false}
                    """))
        .andExpect(status().isOk());

    final ArgumentCaptor<SendAnnouncementRequest> captor =
        ArgumentCaptor.forClass(SendAnnouncementRequest.class);
    verify(announcementService).sendNow(eq(3L), captor.capture());
    assertThat(captor.getValue().markSent()).isFalse();
  }

  @Test
  void sendNowReturnsCounts() throws Exception {
    when(announcementService.sendNow(eq(3L), any(SendAnnouncementRequest.class)))
        .thenReturn(new DispatchResponse(0, 0));

    mockMvc
        .perform(
            post("/api/announcements/send")
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"event_title":"Nonexistent Event","title":"T","message":"M"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.inserted").value(0))
        .andExpect(jsonPath("$.requested").value(0));
  }

  @Test
  void unexpectedErrorsHideInternals() throws Exception {
    when(announcementService.clear(3L)).thenThrow(new IllegalStateException("pool exhausted"));

    mockMvc
        .perform(delete("/api/announcements").header("X-User-Id", "3"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }

  @Test
  void clearReportsDeletedCount() throws Exception {
    when(announcementService.clear(3L)).thenReturn(new ClearAnnouncementsResponse(true, 4));

    mockMvc
        .perform(delete("/api/announcements").header("X-User-Id", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.deleted").value(4));
  }
}
