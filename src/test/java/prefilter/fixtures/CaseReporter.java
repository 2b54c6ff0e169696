package prefilter.fixtures;

interface CaseReporter {

    /**
     * Handler for when a pattern (unexpectedly) fails to parse.
     *
     * @param disassemblyCase case which failed
     * @param error exception that was thrown
     */
    public void onPatternError(DisassemblyCase disassemblyCase, Exception error);

    /**
     * Handler for when the computed substrings differ from the expected ones.
     *
     * @param disassemblyCase case which failed
     * @param what which result differed
     * @param foundOutput output which was found, as JSON
     */
    public void onUnexpectedOutput(DisassemblyCase disassemblyCase, String what, String foundOutput);

    /**
     * Handler for a case passing.
     *
     * @param disassemblyCase case which passed
     * @param expectedFailure the successful behaviour was an error
     */
    public void onSuccess(DisassemblyCase disassemblyCase, boolean expectedFailure);
}
