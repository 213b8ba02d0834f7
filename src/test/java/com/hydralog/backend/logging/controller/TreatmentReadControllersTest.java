package com.hydralog.backend.logging.controller;

import com.hydralog.backend.auth.security.AccessTokenFilter;
import com.hydralog.backend.auth.security.AuthContext;
import com.hydralog.backend.common.time.ClientTimeZoneResolver;
import com.hydralog.backend.common.web.RequestIdFilter;
import com.hydralog.backend.logging.context.ContextEvent;
import com.hydralog.backend.logging.context.ContextState;
import com.hydralog.backend.logging.context.TreatmentContextCoordinator;
import com.hydralog.backend.logging.dto.MonthlySummaryView;
import com.hydralog.backend.logging.dto.SummaryView;
import com.hydralog.backend.logging.error.SyncFailureException;
import com.hydralog.backend.logging.model.PeriodType;
import com.hydralog.backend.logging.queue.LoggingCommand;
import com.hydralog.backend.logging.queue.OfflineOperationQueue;
import com.hydralog.backend.logging.queue.QueuedOperation;
import com.hydralog.backend.logging.service.OfflineAwareLoggingService;
import com.hydralog.backend.logging.service.TreatmentSummaryService;
import com.hydralog.backend.logging.web.LoggingExceptionAdvice;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(
        controllers = {
                TreatmentSummaryController.class,
                OfflineQueueController.class,
                TreatmentContextController.class
        },
        excludeAutoConfiguration = {
                SecurityAutoConfiguration.class,
                SecurityFilterAutoConfiguration.class
        },
        excludeFilters = {
                @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = AccessTokenFilter.class)
        }
)
@Import({LoggingExceptionAdvice.class, RequestIdFilter.class, ClientTimeZoneResolver.class})
class TreatmentReadControllersTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    @Autowired MockMvc mvc;

    @MockitoBean AuthContext auth;
    @MockitoBean TreatmentSummaryService summaries;
    @MockitoBean OfflineOperationQueue queue;
    @MockitoBean OfflineAwareLoggingService submissions;
    @MockitoBean TreatmentContextCoordinator coordinator;

    @Test
    void weekly_summary_by_any_day() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        Mockito.when(summaries.getWeeklySummary(7L, "pet-1", DAY)).thenReturn(SummaryView.empty(PeriodType.WEEKLY, DAY));

        mvc.perform(get("/api/v1/treatments/pet-1/summaries/weekly").param("date", "2026-03-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.periodId").value("2026-W11"))
                .andExpect(jsonPath("$.startDate").value("2026-03-09"));
    }

    @Test
    void monthly_summary_has_day_arrays() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        List<Double> zeros = Collections.nCopies(31, 0.0);
        List<Integer> none = Collections.nCopies(31, 0);
        Mockito.when(summaries.getMonthlySummary(7L, "pet-1", DAY)).thenReturn(new MonthlySummaryView(
                SummaryView.empty(PeriodType.MONTHLY, DAY), zeros, zeros, none, none, none));

        mvc.perform(get("/api/v1/treatments/pet-1/summaries/monthly").param("date", "2026-03-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totals.periodId").value("2026-03"))
                .andExpect(jsonPath("$.dailyVolumes.length()").value(31));
    }

    @Test
    void today_summary_uses_the_client_zone() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        Mockito.when(summaries.getTodaySummary(7L, "pet-1", ZoneId.of("Asia/Taipei")))
                .thenReturn(SummaryView.empty(PeriodType.DAILY, DAY));

        mvc.perform(get("/api/v1/treatments/pet-1/summaries/today").header("X-Client-Timezone", "Asia/Taipei"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.periodType").value("DAILY"));
    }

    @Test
    void bad_date_should_400() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);

        mvc.perform(get("/api/v1/treatments/pet-1/summaries/daily").param("date", "tuesday"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void queue_lists_only_own_operations() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        QueuedOperation op = QueuedOperation.pending(new LoggingCommand.QuickLogAll(7L, "pet-1", "UTC", Instant.EPOCH),
                Instant.parse("2026-03-10T08:00:00Z"));
        Mockito.when(queue.operationsFor(7L)).thenReturn(List.of(op));

        mvc.perform(get("/api/v1/treatments/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(1))
                .andExpect(jsonPath("$.operations[0].command.type").value("quickLogAll"))
                .andExpect(jsonPath("$.operations[0].status").value("PENDING"));
    }

    @Test
    void retry_of_someone_elses_operation_should_404() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        QueuedOperation foreign = QueuedOperation.pending(new LoggingCommand.QuickLogAll(8L, "pet-9", "UTC", Instant.EPOCH),
                Instant.parse("2026-03-10T08:00:00Z"));
        Mockito.when(queue.find(foreign.id())).thenReturn(Optional.of(foreign));

        mvc.perform(post("/api/v1/treatments/queue/" + foreign.id() + "/retry"))
                .andExpect(status().isNotFound());

        Mockito.verify(queue, Mockito.never()).retry(anyString());
    }

    @Test
    void retry_own_failed_operation_should_204() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        QueuedOperation mine = QueuedOperation.pending(new LoggingCommand.QuickLogAll(7L, "pet-1", "UTC", Instant.EPOCH),
                Instant.parse("2026-03-10T08:00:00Z"));
        Mockito.when(queue.find(mine.id())).thenReturn(Optional.of(mine));
        Mockito.when(queue.retry(mine.id())).thenReturn(true);

        mvc.perform(post("/api/v1/treatments/queue/" + mine.id() + "/retry"))
                .andExpect(status().isNoContent());
    }

    @Test
    void sync_with_failures_should_503_tap_to_retry() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        Mockito.when(submissions.syncNow(7L)).thenThrow(new SyncFailureException(1, 1, List.of("op-2")));

        mvc.perform(post("/api/v1/treatments/queue/sync"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("SYNC_FAILURE"))
                .andExpect(jsonPath("$.clientAction").value("TAP_TO_RETRY"));
    }

    @Test
    void profile_ready_passes_pet_and_zone() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);
        ContextEvent expected = new ContextEvent.ProfileReady(7L, "pet-1", ZoneId.of("Europe/Paris"));
        Mockito.when(coordinator.onEvent(expected)).thenReturn(
                new ContextState(7L, true, "pet-1", ZoneId.of("Europe/Paris"), true, null));

        mvc.perform(post("/api/v1/treatments/context/profile-ready")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"petId\":\"pet-1\"}")
                        .header("X-Client-Timezone", "Europe/Paris"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheLoaded").value(true))
                .andExpect(jsonPath("$.timezone").value("Europe/Paris"));
    }

    @Test
    void profile_ready_without_pet_should_400() throws Exception {
        Mockito.when(auth.requireUserId()).thenReturn(7L);

        mvc.perform(post("/api/v1/treatments/context/profile-ready")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILURE"));

        Mockito.verify(coordinator, Mockito.never()).onEvent(any());
    }
}
