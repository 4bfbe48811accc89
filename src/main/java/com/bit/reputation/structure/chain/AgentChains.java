package com.bit.reputation.structure.chain;

import com.bit.reputation.chain.ChainType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 链上 agent 账户中的三条链承诺
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentChains {
    private ChainState feedback;
    private ChainState response;
    private ChainState revoke;

    public ChainState get(ChainType chainType) {
        switch (chainType) {
            case FEEDBACK:
                return feedback;
            case RESPONSE:
                return response;
            case REVOKE:
                return revoke;
            default:
                throw new IllegalArgumentException("未知链类型: " + chainType);
        }
    }

    public void set(ChainType chainType, ChainState state) {
        switch (chainType) {
            case FEEDBACK:
                this.feedback = state;
                break;
            case RESPONSE:
                this.response = state;
                break;
            case REVOKE:
                this.revoke = state;
                break;
            default:
                throw new IllegalArgumentException("未知链类型: " + chainType);
        }
    }

    public static AgentChains empty() {
        return new AgentChains(ChainState.GENESIS, ChainState.GENESIS, ChainState.GENESIS);
    }
}
