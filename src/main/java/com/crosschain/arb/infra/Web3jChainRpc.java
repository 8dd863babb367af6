package com.crosschain.arb.infra;

import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGasPrice;

import java.io.IOException;
import java.math.BigInteger;

public class Web3jChainRpc implements ChainRpc {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Web3j web3j;
    private final String endpoint;

    public Web3jChainRpc(Web3j web3j, String endpoint) {
        this.web3j = web3j;
        this.endpoint = endpoint;
    }

    @Override
    public BigInteger blockNumber() {
        EthBlockNumber response = send("eth_blockNumber", () -> web3j.ethBlockNumber().send());
        return response.getBlockNumber();
    }

    @Override
    public BigInteger gasPriceWei() {
        EthGasPrice response = send("eth_gasPrice", () -> web3j.ethGasPrice().send());
        return response.getGasPrice();
    }

    @Override
    public String call(String to, String data) {
        Transaction tx = Transaction.createEthCallTransaction(ZERO_ADDRESS, to, data);
        EthCall response = send("eth_call",
                () -> web3j.ethCall(tx, DefaultBlockParameterName.LATEST).send());
        if (response.isReverted()) {
            throw new RpcException("eth_call reverted: " + response.getRevertReason());
        }
        return response.getValue();
    }

    @Override
    public void close() {
        web3j.shutdown();
    }

    private <T extends Response<?>> T send(String method, RpcCall<T> call) {
        T response;
        try {
            response = call.execute();
        } catch (IOException e) {
            // Timeouts arrive here as InterruptedIOException
            throw new RpcException(method + " failed on " + endpoint, e);
        }
        if (response.hasError()) {
            throw new RpcException(method + " error " + response.getError().getCode() + ": "
                    + response.getError().getMessage());
        }
        return response;
    }

    @FunctionalInterface
    private interface RpcCall<T> {
        T execute() throws IOException;
    }
}
