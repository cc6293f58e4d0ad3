package com.flagship.account_pro.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTML pages:
 * - dashboard, list, detail and form rendering
 * - create/edit/delete redirects with one-shot notices
 * - validation errors re-render the form
 * - unknown routes and ids
 */
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class AccountPageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Dashboard shows stats and recent accounts")
    void testDashboard() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("text/html"))
            .andExpect(content().string(containsString("Dashboard")))
            .andExpect(content().string(containsString("$26,100.00")))
            .andExpect(content().string(containsString("$8,700.00")))
            .andExpect(content().string(containsString("Mike Chen")));
    }

    @Test
    @DisplayName("Account list applies type and status filters")
    void testListAccounts_Filtered() throws Exception {
        mockMvc.perform(get("/accounts").param("type", "premium").param("status", "active"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("John Doe")))
            .andExpect(content().string(not(containsString("Sarah Johnson"))))
            .andExpect(content().string(not(containsString("Mike Chen"))));

        mockMvc.perform(get("/accounts").param("status", "inactive"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("Mike Chen")))
            .andExpect(content().string(not(containsString("John Doe"))));
    }

    @Test
    @DisplayName("Detail page renders one account")
    void testViewAccount() throws Exception {
        mockMvc.perform(get("/account/2"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("sarah.j@example.com")))
            .andExpect(content().string(containsString("2024-02-20")))
            .andExpect(content().string(containsString("$8,250.00")));
    }

    @Test
    @DisplayName("Unknown account redirects to the list with an error notice")
    void testViewAccount_NotFound() throws Exception {
        mockMvc.perform(get("/account/99"))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("/accounts"))
            .andExpect(flash().attribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.error("Account not found"))));
    }

    @Test
    @DisplayName("Valid create redirects to the new account with a success notice")
    void testCreateAccount_Success() throws Exception {
        mockMvc.perform(get("/account/create"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("Create Account")))
            .andExpect(content().string(not(containsString("name=\"status\""))))
            .andExpect(content().string(containsString("max=\"1000000\"")));

        MvcResult result = mockMvc.perform(post("/account/create")
                .param("firstName", "Nina")
                .param("lastName", "Park")
                .param("email", "Nina.Park@Example.com")
                .param("accountType", "premium")
                .param("department", "Engineering")
                .param("balance", "1234.567"))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("/account/4"))
            .andExpect(flash().attribute(Notice.FLASH_ATTRIBUTE,
                Notices.of(Notice.success("Account created successfully for Nina Park!"))))
            .andReturn();

        mockMvc.perform(get("/account/4").flashAttrs(result.getFlashMap()))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("Account created successfully for Nina Park!")))
            .andExpect(content().string(containsString("nina.park@example.com")))
            .andExpect(content().string(containsString("$1,234.57")));
    }

    @Test
    @DisplayName("Invalid create re-renders the form with every error and the submitted values")
    void testCreateAccount_ValidationErrors() throws Exception {
        mockMvc.perform(post("/account/create")
                .param("firstName", "")
                .param("lastName", "Park")
                .param("email", "john.doe@example.com")
                .param("accountType", "gold")
                .param("department", "Engineering")
                .param("balance", "abc"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("First name is required")))
            .andExpect(content().string(containsString("Email already exists")))
            .andExpect(content().string(containsString("Valid account type is required")))
            .andExpect(content().string(containsString("Invalid balance format")))
            .andExpect(content().string(containsString("value=\"Park\"")));

        mockMvc.perform(get("/accounts"))
            .andExpect(content().string(containsString("(3)")));
    }

    @Test
    @DisplayName("User input is HTML-escaped")
    void testCreateAccount_EscapesHtml() throws Exception {
        mockMvc.perform(post("/account/create")
                .param("firstName", "<script>alert(1)</script>")
                .param("lastName", "O'Brien")
                .param("email", "xss@example.com")
                .param("accountType", "basic")
                .param("department", "${content}")
                .param("balance", "0"))
            .andExpect(redirectedUrl("/account/4"));

        mockMvc.perform(get("/account/4"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("&lt;script&gt;alert(1)&lt;/script&gt;")))
            .andExpect(content().string(containsString("O&#39;Brien")))
            .andExpect(content().string(containsString("&#36;{content}")))
            .andExpect(content().string(not(containsString("<script>alert(1)</script>"))));
    }

    @Test
    @DisplayName("Edit form is pre-filled and includes the status field")
    void testEditForm() throws Exception {
        mockMvc.perform(get("/account/3/edit"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("Edit Account")))
            .andExpect(content().string(containsString("value=\"mike.chen@example.com\"")))
            .andExpect(content().string(containsString("<option value=\"inactive\" selected>")))
            .andExpect(content().string(containsString("<option value=\"basic\" selected>")));
    }

    @Test
    @DisplayName("Valid edit redirects to the account with a success notice")
    void testEditAccount_Success() throws Exception {
        mockMvc.perform(post("/account/3/edit")
                .param("firstName", "Michael")
                .param("lastName", "Chen")
                .param("email", "mike.chen@example.com")
                .param("accountType", "standard")
                .param("department", "Support")
                .param("status", "active")
                .param("balance", "2500"))
            .andExpect(redirectedUrl("/account/3"))
            .andExpect(flash().attribute(Notice.FLASH_ATTRIBUTE,
                Notices.of(Notice.success("Account updated successfully for Michael Chen!"))));

        mockMvc.perform(get("/account/3"))
            .andExpect(content().string(containsString("Michael Chen")))
            .andExpect(content().string(containsString("2024-03-10")));
    }

    @Test
    @DisplayName("Editing to another account's email re-renders the form")
    void testEditAccount_DuplicateEmail() throws Exception {
        mockMvc.perform(post("/account/1/edit")
                .param("firstName", "John")
                .param("lastName", "Doe")
                .param("email", "sarah.j@example.com")
                .param("accountType", "premium")
                .param("department", "Sales")
                .param("status", "")
                .param("balance", "15750"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("Email already exists")))
            .andExpect(content().string(containsString("Valid status is required")));
    }

    @Test
    @DisplayName("Editing an unknown account redirects with an error notice")
    void testEditAccount_NotFound() throws Exception {
        mockMvc.perform(get("/account/99/edit"))
            .andExpect(redirectedUrl("/accounts"))
            .andExpect(flash().attribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.error("Account not found"))));

        mockMvc.perform(post("/account/99/edit").param("firstName", "X"))
            .andExpect(redirectedUrl("/accounts"))
            .andExpect(flash().attribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.error("Account not found"))));
    }

    @Test
    @DisplayName("Delete removes the account; deleting it again reports not found")
    void testDeleteAccount() throws Exception {
        mockMvc.perform(post("/account/3/delete"))
            .andExpect(redirectedUrl("/accounts"))
            .andExpect(flash().attribute(Notice.FLASH_ATTRIBUTE,
                Notices.of(Notice.success("Account for Mike Chen has been deleted successfully"))));

        mockMvc.perform(post("/account/3/delete"))
            .andExpect(redirectedUrl("/accounts"))
            .andExpect(flash().attribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.error("Account not found"))));

        mockMvc.perform(get("/accounts"))
            .andExpect(content().string(not(containsString("Mike Chen"))));
    }

    @Test
    @DisplayName("Unknown routes and non-numeric ids render the 404 page")
    void testNotFoundPage() throws Exception {
        mockMvc.perform(get("/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(content().string(containsString("Page not found")));

        mockMvc.perform(get("/account/abc"))
            .andExpect(status().isNotFound())
            .andExpect(content().string(containsString("Page not found")));
    }
}
