package com.travelbooking.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelbooking.backend.modules.auth.application.AccountStore;
import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.travelbooking.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Str0ng!Passw0rd";
    private static final String NEW_PASSWORD = "N3w!Voyage#Plan";
    private static final Pattern TOKEN_PARAM = Pattern.compile("token=([A-Za-z0-9_-]+)");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountRepository accountRepository;

    @MockBean
    private JavaMailSender mailSender;

    @SpyBean
    private AccountStore accountStore;

    @Test
    void signupVerifyLoginAndLogout() throws Exception {
        String email = "alice@example.com";
        signup(email);

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email, PASSWORD)))
                .andExpect(status().isForbidden());

        verifyEmail(latestTokenFromMail("Verify Your Email Address"));

        String sessionToken = login(email, PASSWORD).path("token").asText();
        mockMvc.perform(get("/profile/me").header("Authorization", "Bearer " + sessionToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.emailVerified").value(true));

        JsonNode rememberMe = readJson(mockMvc.perform(post("/auth/remember-me")
                        .header("Authorization", "Bearer " + sessionToken))
                .andExpect(status().isCreated())
                .andReturn());

        mockMvc.perform(post("/auth/logout").header("Authorization", "Bearer " + sessionToken))
                .andExpect(status().isOk());

        mockMvc.perform(get("/profile/me").header("Authorization", "Bearer " + sessionToken))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/auth/remember-me/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TokenBody(rememberMe.path("token").asText()))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void fifthFailedLoginLocksAccountInDatabase() throws Exception {
        String email = "bob@example.com";
        signup(email);
        verifyEmail(latestTokenFromMail("Verify Your Email Address"));

        for (int attempt = 1; attempt <= 4; attempt++) {
            mockMvc.perform(post("/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(loginBody(email, "Wr0ng!Passphrase")))
                    .andExpect(status().isBadRequest());
        }
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email, "Wr0ng!Passphrase")))
                .andExpect(status().isLocked())
                .andExpect(header().string("Retry-After", "1800"));

        Account account = accountRepository.findByEmail(email).orElseThrow();
        assertThat(account.getFailedLoginAttempts()).isEqualTo(5);
        assertThat(account.getLockedUntil()).isPresent();

        mockMvc.perform(post("/auth/password/forgot")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\"}"))
                .andExpect(status().isOk());
        String resetToken = latestTokenFromMail("Password Reset Request");
        mockMvc.perform(post("/auth/password/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + resetToken + "\",\"newPassword\":\"" + NEW_PASSWORD + "\"}"))
                .andExpect(status().isOk());

        assertThat(login(email, NEW_PASSWORD).path("token").asText()).isNotBlank();
    }

    @Test
    void duplicateSignupIsConflict() throws Exception {
        signup("carol@example.com");

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("carol@example.com")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_REGISTERED"));
    }

    @Test
    void concurrentSignupLosingTheUniqueKeyIsConflictAndSendsNoMail() throws Exception {
        signup("dave@example.com");
        verify(mailSender, timeout(5000)).send(any(SimpleMailMessage.class));
        // the second request passes the existence check as if the first had not committed yet
        doReturn(false).when(accountStore).existsByEmail("dave@example.com");

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody("dave@example.com")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_REGISTERED"));

        assertThat(accountRepository.count()).isEqualTo(1);
        verify(mailSender, after(1000).times(1)).send(any(SimpleMailMessage.class));
    }

    private void signup(String email) throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(signupBody(email)))
                .andExpect(status().isCreated());
    }

    private void verifyEmail(String token) throws Exception {
        mockMvc.perform(post("/auth/verify-email")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TokenBody(token))))
                .andExpect(status().isOk());
    }

    private JsonNode login(String email, String password) throws Exception {
        return readJson(mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email, password)))
                .andExpect(status().isOk())
                .andReturn());
    }

    private String latestTokenFromMail(String subject) {
        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender, timeout(5000).atLeastOnce()).send(captor.capture());
        List<SimpleMailMessage> matching = captor.getAllValues().stream()
                .filter(message -> subject.equals(message.getSubject()))
                .toList();
        assertThat(matching).as("mail with subject %s", subject).isNotEmpty();
        Matcher matcher = TOKEN_PARAM.matcher(matching.get(matching.size() - 1).getText());
        assertThat(matcher.find()).isTrue();
        return matcher.group(1);
    }

    private String signupBody(String email) {
        return """
                {"firstName":"Test","lastName":"Traveller","email":"%s","password":"%s","isOrganiser":false}
                """.formatted(email, PASSWORD);
    }

    private String loginBody(String email, String password) {
        return "{\"email\":\"" + email + "\",\"password\":\"" + password + "\"}";
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private record TokenBody(String token) {
    }
}
