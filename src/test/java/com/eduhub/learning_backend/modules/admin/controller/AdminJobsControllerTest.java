package com.eduhub.learning_backend.modules.admin.controller;

import com.eduhub.learning_backend.common.api.GlobalExceptionHandler;
import com.eduhub.learning_backend.modules.admin.service.AdminRevenueService;
import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.exception.DoubleDistributionException;
import com.eduhub.learning_backend.modules.earnings.mapper.SubscriptionRevenuePoolMapper;
import com.eduhub.learning_backend.modules.earnings.service.RevenueReconcileService;
import com.eduhub.learning_backend.modules.earnings.service.SubscriptionRevenueService;
import com.eduhub.learning_backend.modules.earnings.vo.DistributionResult;
import com.eduhub.learning_backend.modules.subscription.service.SubscriptionAccessService;
import com.eduhub.learning_backend.modules.subscription.service.SubscriptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AdminJobsControllerTest {

    @Mock
    private SubscriptionRevenueService revenueService;
    @Mock
    private RevenueReconcileService reconcileService;
    @Mock
    private SubscriptionRevenuePoolMapper poolMapper;
    @Mock
    private SubscriptionService subscriptionService;
    @Mock
    private SubscriptionAccessService accessService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-04-01T02:00:00Z"), ZoneOffset.UTC);
        AdminRevenueService adminRevenueService = new AdminRevenueService(revenueService, reconcileService,
                poolMapper, new RevenueProperties(), clock);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AdminJobsController(adminRevenueService, subscriptionService, accessService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
    }

    @Test
    void distributeWithoutBodyDefaultsToPreviousMonth() throws Exception {
        when(revenueService.distributeRevenue(Period.parse("2025-03")))
                .thenReturn(DistributionResult.empty("2025-03", "pool-1"));

        mockMvc.perform(post("/api/v1/admin/jobs/distribute-revenue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.data.period").value("2025-03"))
                .andExpect(jsonPath("$.data.poolId").value("pool-1"));
    }

    @Test
    void malformedPeriodIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/admin/jobs/distribute-revenue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"period\":\"2025-13\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));

        verifyNoInteractions(revenueService);
    }

    @Test
    void alreadyDistributedPeriodIsConflict() throws Exception {
        when(revenueService.distributeRevenue(Period.parse("2025-02")))
                .thenThrow(new DoubleDistributionException("2025-02"));

        mockMvc.perform(post("/api/v1/admin/jobs/distribute-revenue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"period\":\"2025-02\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409));
    }

    @Test
    void storageFailureIsServerError() throws Exception {
        when(revenueService.distributeRevenue(any())).thenThrow(new QueryTimeoutException("timeout"));

        mockMvc.perform(post("/api/v1/admin/jobs/distribute-revenue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"period\":\"2025-03\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(500));
    }

    @Test
    void reconcileRequiresPeriod() throws Exception {
        mockMvc.perform(post("/api/v1/admin/jobs/reconcile-revenue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reconcileService);
    }

    @Test
    void checkExpiredSubscriptionsReportsCount() throws Exception {
        when(subscriptionService.checkExpiredSubscriptions()).thenReturn(3);

        mockMvc.perform(post("/api/v1/admin/jobs/check-expired-subscriptions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.expired").value(3));

        verify(subscriptionService).checkExpiredSubscriptions();
    }
}
