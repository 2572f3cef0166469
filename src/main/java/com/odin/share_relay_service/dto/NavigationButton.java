package com.odin.share_relay_service.dto;

import com.odin.share_relay_service.constants.ApplicationConstants;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A button of an inline keyboard. {@code action} is the callback data sent back on press.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NavigationButton {

    private String label;
    private String action;
    private String url;

    public static NavigationButton of(String label, String action) {
        return new NavigationButton(label, action, null);
    }

    public static NavigationButton link(String label, String url) {
        return new NavigationButton(label, null, url);
    }

    public boolean isNoop() {
        return ApplicationConstants.ACTION_NOOP.equals(action);
    }
}
