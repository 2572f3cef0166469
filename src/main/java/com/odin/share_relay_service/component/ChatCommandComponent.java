package com.odin.share_relay_service.component;

import com.odin.share_relay_service.config.ShareRelayProperties;
import com.odin.share_relay_service.constants.ApplicationConstants;
import com.odin.share_relay_service.dto.DeleteOutcome;
import com.odin.share_relay_service.dto.NavigationButton;
import com.odin.share_relay_service.dto.PageWindow;
import com.odin.share_relay_service.dto.ShareSummary;
import com.odin.share_relay_service.dto.ShareSummaryPage;
import com.odin.share_relay_service.exception.ForbiddenException;
import com.odin.share_relay_service.exception.NotFoundException;
import com.odin.share_relay_service.exception.PersistenceException;
import com.odin.share_relay_service.service.DeliveryEngine;
import com.odin.share_relay_service.service.IShareManagementService;
import com.odin.share_relay_service.service.NavigationKeyboardBuilder;
import com.odin.share_relay_service.service.PendingRetrievalService;
import com.odin.share_relay_service.service.SessionStore;
import com.odin.share_relay_service.service.UserNotifier;
import com.odin.share_relay_service.utility.ShareLinkFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Component for the chat surface: commands, callbacks from buttons and free text.
 * Runs on the principal's lane.
 */
@Slf4j
@Component
public class ChatCommandComponent {

    private final UploadComponent uploadComponent;
    private final DeliveryEngine deliveryEngine;
    private final IShareManagementService shareManagementService;
    private final PendingRetrievalService pendingRetrievalService;
    private final SessionStore sessionStore;
    private final UserNotifier userNotifier;
    private final ShareLinkFormatter shareLinkFormatter;
    private final ShareRelayProperties properties;

    public ChatCommandComponent(UploadComponent uploadComponent,
                                DeliveryEngine deliveryEngine,
                                @Qualifier("shareManagementServiceImpl") IShareManagementService shareManagementService,
                                PendingRetrievalService pendingRetrievalService,
                                SessionStore sessionStore,
                                UserNotifier userNotifier,
                                ShareLinkFormatter shareLinkFormatter,
                                ShareRelayProperties properties) {
        this.uploadComponent = uploadComponent;
        this.deliveryEngine = deliveryEngine;
        this.shareManagementService = shareManagementService;
        this.pendingRetrievalService = pendingRetrievalService;
        this.sessionStore = sessionStore;
        this.userNotifier = userNotifier;
        this.shareLinkFormatter = shareLinkFormatter;
        this.properties = properties;
    }

    public void onCommand(String principalId, String name, String args) {
        String command = name == null ? "" : name.trim().toLowerCase();
        switch (command) {
            case ApplicationConstants.COMMAND_START:
                start(principalId, args);
                break;
            case ApplicationConstants.COMMAND_HELP:
                help(principalId);
                break;
            case ApplicationConstants.COMMAND_BEGIN_UPLOAD:
                uploadComponent.beginUpload(principalId);
                break;
            case ApplicationConstants.COMMAND_FINISH_UPLOAD:
                uploadComponent.finishUpload(principalId);
                break;
            case ApplicationConstants.COMMAND_CANCEL:
                uploadComponent.cancel(principalId);
                break;
            case ApplicationConstants.COMMAND_LIST_MY_SHARES:
                showMyShares(principalId, 1, null);
                break;
            default:
                log.info("[CHAT] Unknown command '{}' from principal={}", name, principalId);
                userNotifier.notice(principalId, "Unknown command. Send \"help\" to see what I can do.");
        }
    }

    public void onCallback(String principalId, String data, String messageId) {
        if (data == null || data.isBlank()) {
            log.warn("[CHAT] Empty callback from principal={}", principalId);
            return;
        }
        String[] parts = data.split(ApplicationConstants.CALLBACK_SEPARATOR, 3);
        try {
            switch (parts[0]) {
                case ApplicationConstants.ACTION_NOOP:
                    break;
                case ApplicationConstants.ACTION_SHARE_PAGE:
                    deliveryEngine.retrieve(principalId, parts[2], Integer.parseInt(parts[1]));
                    break;
                case ApplicationConstants.ACTION_LIST_PAGE:
                    showMyShares(principalId, Integer.parseInt(parts[1]), messageId);
                    break;
                case ApplicationConstants.ACTION_DELETE:
                    deleteShare(principalId, parts[1], parts.length > 2 ? Integer.parseInt(parts[2]) : 1, messageId);
                    break;
                case ApplicationConstants.ACTION_INFO:
                    showInfo(principalId, parts[1]);
                    break;
                case ApplicationConstants.ACTION_COMMAND:
                    onCommand(principalId, parts[1], parts.length > 2 ? parts[2] : null);
                    break;
                default:
                    log.warn("[CHAT] Unknown callback '{}' from principal={}", data, principalId);
            }
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            log.warn("[CHAT] Malformed callback '{}' from principal={}", data, principalId);
        }
    }

    public void onText(String principalId, String text) {
        Optional<String> token = shareLinkFormatter.extractToken(text);
        if (token.isPresent()) {
            deliveryEngine.retrieve(principalId, token.get(), 1);
            return;
        }
        if (sessionStore.isCollecting(principalId)) {
            userNotifier.notice(principalId, "⏳ Waiting for your files. Press \"" + ApplicationConstants.BUTTON_FINISH
                    + "\" when you are done.", List.of(List.of(UploadComponent.finishButton())));
        } else {
            userNotifier.notice(principalId, "Send a share link to get its files, or press \""
                    + ApplicationConstants.BUTTON_UPLOAD + "\" to share your own.", List.of(List.of(UploadComponent.uploadButton())));
        }
    }

    private void start(String principalId, String args) {
        Optional<String> token = tokenFrom(args);
        if (token.isEmpty()) {
            token = pendingRetrievalService.pendingToken(principalId);
        }
        if (token.isPresent()) {
            deliveryEngine.retrieve(principalId, token.get(), 1);
            return;
        }
        userNotifier.notice(principalId, "👋 Welcome! Upload files to get a share link, or open a share link to get files.",
                List.of(List.of(UploadComponent.uploadButton())));
    }

    private void help(String principalId) {
        userNotifier.notice(principalId, String.join("\n",
                "How to use:",
                "• begin-upload: start sending files",
                "• finish-upload: get a share link for the files you sent",
                "• cancel: stop the current upload",
                "• list-my-shares: see and delete your shares",
                "• start <token> or a share link: get the files of a share"));
    }

    private void showMyShares(String principalId, int page, String editMessageId) {
        ShareSummaryPage summaries;
        try {
            summaries = shareManagementService.listShares(principalId, page);
        } catch (ForbiddenException e) {
            userNotifier.notice(principalId, "🔒 Access restricted. Join the group to manage your shares.");
            return;
        } catch (PersistenceException e) {
            userNotifier.notice(principalId, "⚠️ Could not load your shares right now. Please try again.");
            return;
        }

        if (summaries.getTotalShares() == 0) {
            userNotifier.replaceOrSend(principalId, editMessageId, "You have no shares yet.",
                    List.of(List.of(UploadComponent.uploadButton())));
            return;
        }

        List<List<NavigationButton>> keyboard = new ArrayList<>();
        for (ShareSummary share : summaries.getShares()) {
            keyboard.add(List.of(
                    NavigationButton.of("📄 " + shorten(share.getCaption()), action(ApplicationConstants.ACTION_INFO, share.getShareToken())),
                    NavigationButton.of(ApplicationConstants.BUTTON_DELETE,
                            action(ApplicationConstants.ACTION_DELETE, share.getShareToken(), String.valueOf(summaries.getPage())))));
        }
        PageWindow window = new PageWindow(summaries.getPage(), summaries.getTotalPages(), 0, summaries.getShares().size());
        keyboard.addAll(NavigationKeyboardBuilder.build(window,
                target -> action(ApplicationConstants.ACTION_LIST_PAGE, String.valueOf(target))));

        String text = "📂 Your shares (" + summaries.getTotalShares() + ") · page "
                + summaries.getPage() + " of " + summaries.getTotalPages();
        userNotifier.replaceOrSend(principalId, editMessageId, text, keyboard);
    }

    private void deleteShare(String principalId, String shareToken, int page, String listMessageId) {
        try {
            DeleteOutcome outcome = shareManagementService.deleteShare(shareToken, principalId);
            userNotifier.notice(principalId, outcome.isClean()
                    ? "🗑️ Share deleted."
                    : "🗑️ Share deleted, but " + outcome.getWarnings().size() + " file(s) could not be removed from storage.");
        } catch (NotFoundException e) {
            userNotifier.notice(principalId, "This share was already removed.");
        } catch (ForbiddenException e) {
            userNotifier.notice(principalId, "⛔ You can only delete your own shares.");
            return;
        } catch (PersistenceException e) {
            userNotifier.notice(principalId, "⚠️ Could not delete the share right now. Please try again.");
            return;
        }
        showMyShares(principalId, page, listMessageId);
    }

    private void showInfo(String principalId, String shareToken) {
        try {
            String link = shareManagementService.getLink(shareToken, principalId);
            userNotifier.notice(principalId, "🔗 " + link);
        } catch (NotFoundException e) {
            userNotifier.notice(principalId, "This share was already removed.");
        } catch (ForbiddenException e) {
            userNotifier.notice(principalId, "⛔ This is not your share.");
        } catch (PersistenceException e) {
            userNotifier.notice(principalId, "⚠️ Could not load the share right now. Please try again.");
        }
    }

    private Optional<String> tokenFrom(String args) {
        if (args == null || args.isBlank()) {
            return Optional.empty();
        }
        Optional<String> fromLink = shareLinkFormatter.extractToken(args);
        return fromLink.isPresent() ? fromLink : Optional.of(args.trim());
    }

    private String shorten(String caption) {
        String text = caption == null ? ApplicationConstants.DEFAULT_CAPTION : caption;
        int max = properties.getListCaptionLength();
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    private static String action(String name, String... args) {
        return name + ApplicationConstants.CALLBACK_SEPARATOR + String.join(ApplicationConstants.CALLBACK_SEPARATOR, args);
    }
}
