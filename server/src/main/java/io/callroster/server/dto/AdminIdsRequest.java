package io.callroster.server.dto;

import java.util.List;

/** JSON body for POST /calls/{callId}/admins: { "adminIds": [1, 2] } */
public class AdminIdsRequest {
    public List<Long> adminIds;
}
