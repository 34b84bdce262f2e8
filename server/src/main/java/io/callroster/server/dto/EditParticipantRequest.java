package io.callroster.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of POST /calls/{id}/participants/{peerId} on the gateway.
 * Absent fields are not part of the change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EditParticipantRequest {
    public Boolean muted;
    public Integer volume;
    public Boolean raiseHand;
}
