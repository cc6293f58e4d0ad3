package com.flagship.account_pro.web;

import com.flagship.account_pro.account.Account;
import com.flagship.account_pro.account.AccountNotFoundException;
import com.flagship.account_pro.account.AccountService;
import com.flagship.account_pro.account.dto.AccountForm;
import com.flagship.account_pro.config.AccountProProperties;
import com.flagship.account_pro.stats.AccountStatsService;
import com.flagship.account_pro.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;
import org.springframework.web.servlet.view.RedirectView;

import java.util.List;

/**
 * Server-rendered account pages.
 *
 * Successful mutations redirect and leave a notice for the next page;
 * rejected submissions re-render the form with every validation error.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class AccountPageController {

    private static final String ACCOUNT_NOT_FOUND = "Account not found";

    private final AccountService accountService;
    private final AccountStatsService statsService;
    private final AccountPages pages;
    private final AccountProProperties properties;

    @GetMapping("/")
    public ModelAndView dashboard(Model model) {
        int recentLimit = properties.getDashboard().getRecentLimit();
        return page(pages.dashboard(
            statsService.computeStats(),
            accountService.recentAccounts(recentLimit),
            notices(model)));
    }

    @GetMapping("/accounts")
    public ModelAndView listAccounts(@RequestParam(name = "type", defaultValue = "") String type,
                                     @RequestParam(name = "status", defaultValue = "") String status,
                                     Model model) {
        List<Account> accounts = accountService.listAccounts(type, status);
        return page(pages.accountList(accounts, type, status, notices(model)));
    }

    @GetMapping("/account/{id}")
    public ModelAndView viewAccount(@PathVariable("id") long id, Model model, RedirectAttributes redirect) {
        return accountService.findAccount(id)
            .map(account -> page(pages.accountDetail(account, notices(model))))
            .orElseGet(() -> notFound(redirect));
    }

    @GetMapping("/account/create")
    public ModelAndView createForm(Model model) {
        return page(pages.accountForm(null, null, notices(model)));
    }

    @PostMapping("/account/create")
    public ModelAndView createAccount(@ModelAttribute AccountForm form, RedirectAttributes redirect) {
        ValidationResult<Account> result = accountService.createAccount(form);
        if (!result.isValid()) {
            return page(pages.accountForm(form, null, errorNotices(result)));
        }

        Account account = result.getValue();
        redirect.addFlashAttribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.success(
            "Account created successfully for " + account.getFullName() + "!")));
        return redirectTo("/account/" + account.getId());
    }

    @GetMapping("/account/{id}/edit")
    public ModelAndView editForm(@PathVariable("id") long id, Model model, RedirectAttributes redirect) {
        return accountService.findAccount(id)
            .map(account -> page(pages.accountForm(AccountForm.from(account), account, notices(model))))
            .orElseGet(() -> notFound(redirect));
    }

    @PostMapping("/account/{id}/edit")
    public ModelAndView editAccount(@PathVariable("id") long id,
                                    @ModelAttribute AccountForm form,
                                    RedirectAttributes redirect) {
        ValidationResult<Account> result;
        try {
            result = accountService.updateAccount(id, form);
        } catch (AccountNotFoundException e) {
            return notFound(redirect);
        }

        if (!result.isValid()) {
            // the account can be deleted between the rejected update and this read
            return accountService.findAccount(id)
                .map(current -> page(pages.accountForm(form, current, errorNotices(result))))
                .orElseGet(() -> notFound(redirect));
        }

        Account account = result.getValue();
        redirect.addFlashAttribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.success(
            "Account updated successfully for " + account.getFullName() + "!")));
        return redirectTo("/account/" + id);
    }

    @PostMapping("/account/{id}/delete")
    public ModelAndView deleteAccount(@PathVariable("id") long id, RedirectAttributes redirect) {
        Account removed;
        try {
            removed = accountService.deleteAccount(id);
        } catch (AccountNotFoundException e) {
            return notFound(redirect);
        }

        redirect.addFlashAttribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.success(
            "Account for " + removed.getFullName() + " has been deleted successfully")));
        return redirectTo("/accounts");
    }

    private ModelAndView notFound(RedirectAttributes redirect) {
        redirect.addFlashAttribute(Notice.FLASH_ATTRIBUTE, Notices.of(Notice.error(ACCOUNT_NOT_FOUND)));
        return redirectTo("/accounts");
    }

    private static ModelAndView page(String html) {
        return new ModelAndView(new HtmlView(html));
    }

    private static ModelAndView redirectTo(String path) {
        return new ModelAndView(new RedirectView(path, true));
    }

    private static List<Notice> errorNotices(ValidationResult<?> result) {
        return result.getErrors().stream().map(Notice::error).toList();
    }

    private static List<Notice> notices(Model model) {
        Notices notices = (Notices) model.getAttribute(Notice.FLASH_ATTRIBUTE);
        return notices != null ? notices.getItems() : List.of();
    }
}
