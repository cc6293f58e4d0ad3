package com.flagship.account_pro.web;

import com.flagship.account_pro.account.Account;
import com.flagship.account_pro.account.AccountStatus;
import com.flagship.account_pro.account.AccountType;
import com.flagship.account_pro.account.dto.AccountForm;
import com.flagship.account_pro.config.AccountProProperties;
import com.flagship.account_pro.stats.AccountStats;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.flagship.account_pro.web.PageRenderer.escapeHtml;

/**
 * HTML for each account page. Builds the dynamic fragments (table rows,
 * select options) and hands them to the {@link PageRenderer}.
 */
@Component
public class AccountPages {

    private final PageRenderer renderer;
    private final AccountProProperties properties;

    public AccountPages(PageRenderer renderer, AccountProProperties properties) {
        this.renderer = renderer;
        this.properties = properties;
    }

    public String dashboard(AccountStats stats, List<Account> recentAccounts, List<Notice> notices) {
        Map<String, String> values = new HashMap<>();
        values.put("totalAccounts", String.valueOf(stats.getTotalAccounts()));
        values.put("activeAccounts", String.valueOf(stats.getActiveAccounts()));
        values.put("inactiveAccounts", String.valueOf(stats.getInactiveAccounts()));
        values.put("totalBalance", formatMoney(stats.getTotalBalance()));
        values.put("averageBalance", formatMoney(stats.getAverageBalance()));
        values.put("recentRows", accountRows(recentAccounts, "No accounts yet."));
        return renderer.render("Dashboard", "dashboard", values, notices);
    }

    public String accountList(List<Account> accounts, String typeFilter, String statusFilter, List<Notice> notices) {
        Map<String, String> values = new HashMap<>();
        values.put("count", String.valueOf(accounts.size()));
        values.put("typeOptions", typeOptions(typeFilter, true));
        values.put("statusOptions", statusOptions(statusFilter, true));
        values.put("accountRows", accountRows(accounts, "No accounts match the selected filters."));
        return renderer.render("Accounts", "accounts", values, notices);
    }

    public String accountDetail(Account account, List<Notice> notices) {
        Map<String, String> values = new HashMap<>();
        values.put("id", String.valueOf(account.getId()));
        values.put("fullName", escapeHtml(account.getFullName()));
        values.put("email", escapeHtml(account.getEmail()));
        values.put("accountType", account.getAccountType().value());
        values.put("department", escapeHtml(account.getDepartment()));
        values.put("status", account.getStatus().value());
        values.put("createdDate", account.getCreatedDate().toString());
        values.put("balance", formatMoney(account.getBalance()));
        return renderer.render(account.getFullName(), "account_detail", values, notices);
    }

    /**
     * Create form when {@code account} is null, edit form otherwise.
     */
    public String accountForm(AccountForm form, Account account, List<Notice> notices) {
        boolean editing = account != null;
        AccountForm data = form != null ? form : new AccountForm();

        Map<String, String> values = new HashMap<>();
        values.put("heading", editing ? "Edit Account" : "Create Account");
        values.put("action", editing ? "/account/" + account.getId() + "/edit" : "/account/create");
        values.put("cancelUrl", editing ? "/account/" + account.getId() : "/accounts");
        values.put("submitLabel", editing ? "Save Changes" : "Create Account");
        values.put("firstName", escapeHtml(data.getFirstName()));
        values.put("lastName", escapeHtml(data.getLastName()));
        values.put("email", escapeHtml(data.getEmail()));
        values.put("department", escapeHtml(data.getDepartment()));
        values.put("balance", escapeHtml(data.getBalance() != null ? data.getBalance() : "0"));
        values.put("maxBalance", properties.getBalance().getMax().toPlainString());
        values.put("typeOptions", typeOptions(data.getAccountType(), false));
        values.put("statusField", editing ? statusField(data.getStatus()) : "");
        return renderer.render(values.get("heading"), "account_form", values, notices);
    }

    public String error(int code, String message) {
        return renderer.render("Error " + code, "error", Map.of(
            "code", String.valueOf(code),
            "message", escapeHtml(message)
        ), List.of());
    }

    private String accountRows(List<Account> accounts, String emptyMessage) {
        if (accounts.isEmpty()) {
            return "<tr><td colspan=\"6\" class=\"empty-row\">" + escapeHtml(emptyMessage) + "</td></tr>";
        }
        StringBuilder builder = new StringBuilder();
        for (Account account : accounts) {
            builder.append("<tr>")
                    .append("<td><a href=\"/account/").append(account.getId()).append("\">")
                    .append(escapeHtml(account.getFullName())).append("</a></td>")
                    .append("<td>").append(escapeHtml(account.getEmail())).append("</td>")
                    .append("<td>").append(account.getAccountType().value()).append("</td>")
                    .append("<td>").append(escapeHtml(account.getDepartment())).append("</td>")
                    .append("<td><span class=\"badge badge-").append(account.getStatus().value()).append("\">")
                    .append(account.getStatus().value()).append("</span></td>")
                    .append("<td class=\"money\">").append(formatMoney(account.getBalance())).append("</td>")
                    .append("</tr>");
        }
        return builder.toString();
    }

    private String typeOptions(String selected, boolean includeAny) {
        StringBuilder builder = new StringBuilder();
        builder.append(option("", includeAny ? "All types" : "Select a type", selected));
        for (AccountType type : AccountType.values()) {
            builder.append(option(type.value(), capitalize(type.value()), selected));
        }
        return builder.toString();
    }

    private String statusOptions(String selected, boolean includeAny) {
        StringBuilder builder = new StringBuilder();
        if (includeAny) {
            builder.append(option("", "All statuses", selected));
        }
        for (AccountStatus status : AccountStatus.values()) {
            builder.append(option(status.value(), capitalize(status.value()), selected));
        }
        return builder.toString();
    }

    private String statusField(String selected) {
        return "<label for=\"status\">Status</label>"
                + "<select id=\"status\" name=\"status\">" + statusOptions(selected, false) + "</select>";
    }

    private String option(String value, String label, String selected) {
        boolean isSelected = value.equals(selected == null ? "" : selected);
        return "<option value=\"" + escapeHtml(value) + "\"" + (isSelected ? " selected" : "") + ">"
                + escapeHtml(label) + "</option>";
    }

    private static String capitalize(String value) {
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    static String formatMoney(BigDecimal amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }
}
