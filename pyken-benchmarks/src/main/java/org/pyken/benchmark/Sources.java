package org.pyken.benchmark;

/**
 * Benchmark inputs.
 */
final class Sources {

    static final String HELPER = """
            def clamp(x: int, low: int, high: int) -> int:
                if x < low:
                    return low
                elif x > high:
                    return high
                return x
            """;

    static final String VESTING = """
            from cardano.script_context import ScriptContext


            class VestingDatum:
                beneficiary: bytes
                deadline: int


            def is_signed(signatories: List[bytes], key: bytes) -> bool:
                return key in signatories


            @spend
            def vesting(datum: VestingDatum, redeemer, context: ScriptContext) -> bool:
                assert datum.deadline > 0, "deadline must be set"
                owner = datum.beneficiary
                print("checking", owner)
                return len(owner) == 28
            """;

    static final String POLICY = """
            class Action:
                Mint = 0
                Burn = 1


            class Policy:
                @staticmethod
                def mint(redeemer: Action, context) -> bool:
                    if redeemer == Action.Mint:
                        return True
                    elif redeemer == Action.Burn:
                        return False

                @staticmethod
                def else_(context) -> bool:
                    return False
            """;

    private Sources() {
    }
}
