package com.crosschain.arb.infra;

import com.crosschain.arb.config.RpcProperties;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.concurrent.TimeUnit;

/**
 * Opens web3j connections over a shared OkHttp client so every RPC call carries an explicit timeout.
 */
@Component
public class ChainRpcFactory {

    private final OkHttpClient httpClient;

    public ChainRpcFactory(RpcProperties properties) {
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .callTimeout(properties.getCallTimeoutMs(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    public ChainRpc connect(String rpcUrl) {
        return new Web3jChainRpc(Web3j.build(new HttpService(rpcUrl, httpClient)), rpcUrl);
    }
}
