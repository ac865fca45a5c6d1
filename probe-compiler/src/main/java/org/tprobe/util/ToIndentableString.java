package org.tprobe.util;

/** Interface implemented by objects that can be printed to an {@link IIndentStream}. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);
}
