package io.callroster.server.dto;

/** JSON body for POST /calls/{callId}/load-more: { "token": "..." } */
public class LoadMoreRequest {
    public String token;
}
