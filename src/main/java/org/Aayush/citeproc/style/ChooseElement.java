package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

import java.util.List;

/**
 * {@code <choose>}: renders the first branch whose conditions hold.
 */
@Value
@Builder
public class ChooseElement implements Element {
    @Singular
    List<ChooseBranch> branches;

    @Override
    public ElementKind kind() {
        return ElementKind.CHOOSE;
    }

    @Override
    public Formatting getFormatting() {
        return Formatting.EMPTY;
    }

    @Override
    public String describe() {
        return "choose[" + branches.size() + " branches]";
    }
}
