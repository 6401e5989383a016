package com.pushcast.dispatcher.api;

import com.pushcast.dispatcher.model.DevicePlatform;
import com.pushcast.dispatcher.model.DeviceToken;
import com.pushcast.dispatcher.registry.TargetRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RegistryController.class)
class RegistryControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean TargetRegistry registry;

    @Test
    void register_returns201() throws Exception {
        when(registry.registerToken("tok-1", "user-1", DevicePlatform.ANDROID))
                .thenReturn(new DeviceToken("tok-1", "user-1", DevicePlatform.ANDROID));

        mockMvc.perform(post("/registry/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"token":"tok-1","userId":"user-1","platform":"android"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token").value("tok-1"))
                .andExpect(jsonPath("$.platform").value("ANDROID"));
    }

    @Test
    void subscribe_returnsAddedCount() throws Exception {
        when(registry.subscribe(List.of("a", "b"), "news")).thenReturn(1);

        mockMvc.perform(post("/registry/topics/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokens":["a","b"],"topic":"news"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topic").value("news"))
                .andExpect(jsonPath("$.subscribed").value(1));
    }

    @Test
    void subscribe_withoutTokens_returns400() throws Exception {
        mockMvc.perform(post("/registry/topics/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokens":[],"topic":"news"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("invalid-payload"));
        verifyNoInteractions(registry);
    }

    @Test
    void unsubscribe_returnsRemovedCount() throws Exception {
        when(registry.unsubscribe(List.of("a"), "news")).thenReturn(1);

        mockMvc.perform(post("/registry/topics/unsubscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokens":["a"],"topic":"news"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unsubscribed").value(1));
    }

    @Test
    void topicsOfToken_listsMemberships() throws Exception {
        when(registry.topicsOf("tok-1")).thenReturn(List.of("news", "tournament_42"));

        mockMvc.perform(get("/registry/tokens/{token}/topics", "tok-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topics[1]").value("tournament_42"));
    }

    @Test
    void remove_unknownToken_reportsFalse() throws Exception {
        when(registry.removeToken("gone")).thenReturn(false);

        mockMvc.perform(delete("/registry/tokens/{token}", "gone"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(false));
    }
}
