package com.receptionkit.backend.workflow.domain;

/** Built-in follow-up behaviours attached to nodes or answer options. Opaque to the engine. */
public enum WorkflowActionKey {
  FORWARD_TO_GP,
  FORWARD_TO_PRESCRIBING_TEAM,
  FORWARD_TO_PHARMACY_TEAM,
  FILE_WITHOUT_FORWARDING,
  ADD_TO_YELLOW_SLOT,
  SEND_STANDARD_LETTER,
  CODE_AND_FILE,
  OPEN_REFERENCE,
  OTHER
}
