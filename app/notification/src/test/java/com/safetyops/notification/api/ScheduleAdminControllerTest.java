/*
 * Where: Notification admin API test
 * What: Exercises the schedule hooks and the error mapping through MockMvc
 * Why: The schedule editor depends on these paths and response shapes
 */
package com.safetyops.notification.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.safetyops.notification.service.ScheduleRegistry;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ScheduleAdminControllerTest {

  @Mock private ScheduleRegistry registry;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ScheduleAdminController(registry))
            .setControllerAdvice(new NotificationApiExceptionHandler())
            .build();
  }

  @Test
  void reloadReportsRegistration() throws Exception {
    when(registry.reload("tbm-reminder")).thenReturn(true);

    mockMvc
        .perform(post("/admin/schedules/tbm-reminder:reload"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("tbm-reminder"))
        .andExpect(jsonPath("$.registered").value(true));
  }

  @Test
  void reloadOfDeletedIdIsNotAnError() throws Exception {
    when(registry.reload("gone")).thenReturn(false);

    mockMvc
        .perform(post("/admin/schedules/gone:reload"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.registered").value(false));
  }

  @Test
  void stopReturnsNoContent() throws Exception {
    mockMvc.perform(post("/admin/schedules/tbm-reminder:stop")).andExpect(status().isNoContent());

    verify(registry).stop("tbm-reminder");
  }

  @Test
  void loadAllReturnsCountAndActiveIds() throws Exception {
    when(registry.loadAll()).thenReturn(2);
    when(registry.activeIds())
        .thenReturn(new TreeSet<>(Set.of("education-reminder", "tbm-reminder")));

    mockMvc
        .perform(post("/admin/schedules/load-all"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.registered").value(2))
        .andExpect(jsonPath("$.active[0]").value("education-reminder"))
        .andExpect(jsonPath("$.active[1]").value("tbm-reminder"));
  }

  @Test
  void activeListsRegisteredIds() throws Exception {
    when(registry.activeIds()).thenReturn(new TreeSet<>(Set.of("tbm-reminder")));

    mockMvc
        .perform(get("/admin/schedules/active"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("tbm-reminder"));
  }

  @Test
  void storeOutageMapsToServiceUnavailable() throws Exception {
    when(registry.loadAll()).thenThrow(new DataAccessResourceFailureException("db down"));

    mockMvc
        .perform(post("/admin/schedules/load-all"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
  }
}
