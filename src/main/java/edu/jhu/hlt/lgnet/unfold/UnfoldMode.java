package edu.jhu.hlt.lgnet.unfold;

/**
 * Whether a formula occurrence is being unfolded as a hypothesis (left of the
 * turnstile) or as a conclusion (right of it).
 */
public enum UnfoldMode {
  HYPOTHESIS, CONCLUSION
}
