package com.vidly.unit.controller;

import com.vidly.config.PropertiesConfig;
import com.vidly.config.SecurityConfig;
import com.vidly.controller.UserController;
import com.vidly.dto.response.UserResponse;
import com.vidly.service.UserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserController.class)
@Import({SecurityConfig.class, PropertiesConfig.class})
class UserControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UserService userService;

    @Test
    void me_returnsUserNamedByTokenSubject() throws Exception {
        when(userService.findByTokenSubject("7"))
            .thenReturn(new UserResponse(7L, "Jane Doe", "jane@vidly.com", false));

        mockMvc.perform(get("/api/users/me").with(jwt().jwt(token -> token.subject("7"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(7))
            .andExpect(jsonPath("$.isAdmin").value(false));
    }

    @Test
    void me_withoutToken_returns401() throws Exception {
        mockMvc.perform(get("/api/users/me"))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(userService);
    }

    @Test
    void findAll_asNonAdmin_returns403() throws Exception {
        mockMvc.perform(get("/api/users").with(jwt()))
            .andExpect(status().isForbidden());
    }

    @Test
    void findAll_asAdmin_returns200() throws Exception {
        when(userService.findAll()).thenReturn(List.of(new UserResponse(1L, "Admin User", "admin@vidly.com", true)));

        mockMvc.perform(get("/api/users").with(jwt().authorities(new SimpleGrantedAuthority("ROLE_ADMIN"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].isAdmin").value(true));
    }
}
