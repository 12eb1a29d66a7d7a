package com.strategylab.optimizer.domain.strategy;

import com.strategylab.optimizer.domain.InvalidParameterException;
import com.strategylab.optimizer.domain.Signal;
import com.strategylab.optimizer.indicator.IndicatorSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Votes across member strategies evaluated on the same bar.
 */
@Slf4j
public class CombinedStrategy implements Strategy {

    private final List<Strategy> members;
    private final VotingRule votingRule;

    public CombinedStrategy(List<Strategy> members, VotingRule votingRule) {
        if (members == null || members.isEmpty()) {
            throw new InvalidParameterException("Combined strategy needs at least one member");
        }
        if (votingRule == null) {
            throw new InvalidParameterException("Voting rule is required");
        }
        this.members = List.copyOf(members);
        this.votingRule = votingRule;
    }

    @Override
    public Signal generateSignal(StrategyContext context) {
        List<Signal> votes = members.stream()
                .map(member -> member.generateSignal(context))
                .toList();
        Signal decision = votingRule.decide(votes);

        if (decision != Signal.HOLD) {
            log.debug("Combined: {} at bar {} from votes {}", decision, context.index(), votes);
        }
        return decision;
    }

    /**
     * Union of the members' indicators; equal specs appear once.
     */
    @Override
    public List<IndicatorSpec> requiredIndicators() {
        Set<IndicatorSpec> specs = new LinkedHashSet<>();
        members.forEach(member -> specs.addAll(member.requiredIndicators()));
        return List.copyOf(specs);
    }

    @Override
    public int minimumBars() {
        return members.stream().mapToInt(Strategy::minimumBars).max().orElse(1);
    }

    @Override
    public StrategyType getType() {
        return StrategyType.COMBINED;
    }

    public List<Strategy> getMembers() {
        return members;
    }

    public VotingRule getVotingRule() {
        return votingRule;
    }

    @Override
    public String getName() {
        return "Combined[" + votingRule + "](" + members.stream().map(Strategy::getName)
                .collect(Collectors.joining(",")) + ")";
    }
}
