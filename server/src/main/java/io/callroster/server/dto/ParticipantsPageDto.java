package io.callroster.server.dto;

import java.util.List;

/** Response of GET /calls/{id}/participants on the gateway. */
public class ParticipantsPageDto {
    public List<ParticipantDto> participants;
    public String nextOffset;         // null or "" when exhausted
    public int totalCount;
    public int version;
    public boolean sortAscending;
    public boolean isCreator;         // first page only: viewer created the call
    public List<Long> adminIds;       // first page only
}
