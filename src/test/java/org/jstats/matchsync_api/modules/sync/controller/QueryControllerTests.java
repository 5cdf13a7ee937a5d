package org.jstats.matchsync_api.modules.sync.controller;

import org.jstats.matchsync_api.modules.store.model.FixturePage;
import org.jstats.matchsync_api.modules.store.model.FixtureQuery;
import org.jstats.matchsync_api.modules.store.model.FixtureView;
import org.jstats.matchsync_api.modules.store.model.TeamSummary;
import org.jstats.matchsync_api.modules.sync.service.DataSyncService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueryController.class)
class QueryControllerTests {

    @Autowired MockMvc mockMvc;

    @MockBean DataSyncService syncService;

    @Test
    void teams_wrapsListWithCount() throws Exception {
        when(syncService.listTeams()).thenReturn(List.of(
                new TeamSummary(1, "Arsenal", null, 38),
                new TeamSummary(2, "Chelsea", "Chelsea FC", 37)));

        mockMvc.perform(get("/api/teams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount", is(2)))
                .andExpect(jsonPath("$.teams[1].fullName", is("Chelsea FC")));
    }

    @Test
    void fixtures_defaultsPaging() throws Exception {
        when(syncService.listFixtures(any())).thenAnswer(inv -> FixturePage.of(List.of(), 0, inv.getArgument(0)));

        mockMvc.perform(get("/api/fixtures"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit", is(100)))
                .andExpect(jsonPath("$.offset", is(0)))
                .andExpect(jsonPath("$.hasMore", is(false)));

        verify(syncService).listFixtures(new FixtureQuery(null, null, 100, 0));
    }

    @Test
    void fixtures_forwardsFilters() throws Exception {
        var view = new FixtureView(7L, LocalDate.of(2024, 8, 17), 2024, "Premier League",
                "Arsenal", "Wolves", 2, 0, 1.3, 9.0);
        when(syncService.listFixtures(any())).thenAnswer(inv -> FixturePage.of(List.of(view), 3, inv.getArgument(0)));

        mockMvc.perform(get("/api/fixtures").param("season", "2024").param("team", "Arsenal").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fixtures[0].homeTeam", is("Arsenal")))
                .andExpect(jsonPath("$.fixtures[0].date", is("2024-08-17")))
                .andExpect(jsonPath("$.hasMore", is(true)));

        verify(syncService).listFixtures(new FixtureQuery(2024, "Arsenal", 1, 0));
    }

    @Test
    void fixtures_rejectsOutOfRangeLimit() throws Exception {
        mockMvc.perform(get("/api/fixtures").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/fixtures").param("limit", "1001"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(syncService);
    }

    @Test
    void fixtures_rejectsNegativeOffsetLongTeamAndBadSeason() throws Exception {
        mockMvc.perform(get("/api/fixtures").param("offset", "-1"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/fixtures").param("team", "x".repeat(51)))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/fixtures").param("season", "twenty"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title", is("Bad Request")));
        mockMvc.perform(get("/api/fixtures").param("limit", "ten"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(syncService);
    }
}
