package com.receptionkit.backend.workflow.domain;

/**
 * Node kinds together with the capabilities the mutation API and the execution engine rely on.
 * Code asks the type what it can do instead of comparing against individual constants.
 */
public enum WorkflowNodeType {
  INSTRUCTION("New instruction", 1, true, false),
  QUESTION("New question", Integer.MAX_VALUE, false, false),
  END("New outcome", 0, false, true),
  PANEL("New panel", 0, true, false),
  REFERENCE("New reference", 0, true, false);

  private final String defaultTitle;
  private final int maxAuthoredEdges;
  private final boolean implicitContinue;
  private final boolean terminal;

  WorkflowNodeType(
      String defaultTitle, int maxAuthoredEdges, boolean implicitContinue, boolean terminal) {
    this.defaultTitle = defaultTitle;
    this.maxAuthoredEdges = maxAuthoredEdges;
    this.implicitContinue = implicitContinue;
    this.terminal = terminal;
  }

  public String defaultTitle() {
    return defaultTitle;
  }

  /** More than one authored outgoing edge, each offered as a separate answer. */
  public boolean supportsBranching() {
    return maxAuthoredEdges > 1;
  }

  public int maxAuthoredEdges() {
    return maxAuthoredEdges;
  }

  /** The engine synthesizes a single continue choice when no authored edge applies. */
  public boolean hasImplicitContinue() {
    return implicitContinue;
  }

  /** Reaching a terminal node completes the instance. */
  public boolean isTerminal() {
    return terminal;
  }
}
