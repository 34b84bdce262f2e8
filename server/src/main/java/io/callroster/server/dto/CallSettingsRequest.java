package io.callroster.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of POST /calls/{id}/recording and POST /calls/{id}/settings on the gateway.
 * Only the fields relevant to the endpoint are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallSettingsRequest {
    public Boolean record;
    public String title;
    public Boolean defaultMuted;
    public Boolean resetInviteLink;
}
