package com.example.aurawatch.rpc;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JsonRpcRequest {
    private String jsonrpc = "2.0";
    private long id;
    private String method;
    private List<Object> params;

    public JsonRpcRequest(long id, String method, List<Object> params) {
        this.id = id;
        this.method = method;
        this.params = params;
    }
}
