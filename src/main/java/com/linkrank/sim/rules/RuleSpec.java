package com.linkrank.sim.rules;

import com.linkrank.sim.api.ValidationException;
import com.linkrank.sim.model.LinkPosition;

/**
 * A cumulative linking rule: for every page passing the source filter, pick
 * up to {@code linksPerPage} targets passing the target filter using the
 * selection method.
 */
public record RuleSpec(PageFilter sourceFilter, PageFilter targetFilter, SelectionMethod selectionMethod,
        int linksPerPage, boolean bidirectional, boolean avoidSelfLinks, LinkPosition position)
        implements LinkRule {

    public static final int DEFAULT_LINKS_PER_PAGE = 3;

    public RuleSpec {
        if (linksPerPage < 0)
            throw new ValidationException("linksPerPage must be >= 0: " + linksPerPage);
        sourceFilter = sourceFilter == null ? PageFilter.ANY : sourceFilter;
        targetFilter = targetFilter == null ? PageFilter.ANY : targetFilter;
        selectionMethod = selectionMethod == null ? SelectionMethod.DEFAULT : selectionMethod;
        position = position == null ? LinkPosition.CONTENT : position;
    }

    @Override
    public RuleKind kind() {
        return RuleKind.LINKING;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PageFilter sourceFilter = PageFilter.ANY;
        private PageFilter targetFilter = PageFilter.ANY;
        private SelectionMethod selectionMethod = SelectionMethod.DEFAULT;
        private int linksPerPage = DEFAULT_LINKS_PER_PAGE;
        private boolean bidirectional;
        private boolean avoidSelfLinks = true;
        private LinkPosition position = LinkPosition.CONTENT;

        public Builder from(PageFilter filter) {
            this.sourceFilter = filter;
            return this;
        }

        public Builder to(PageFilter filter) {
            this.targetFilter = filter;
            return this;
        }

        public Builder selection(SelectionMethod method) {
            this.selectionMethod = method;
            return this;
        }

        public Builder linksPerPage(int n) {
            this.linksPerPage = n;
            return this;
        }

        public Builder bidirectional(boolean value) {
            this.bidirectional = value;
            return this;
        }

        public Builder avoidSelfLinks(boolean value) {
            this.avoidSelfLinks = value;
            return this;
        }

        public Builder position(LinkPosition value) {
            this.position = value;
            return this;
        }

        public RuleSpec build() {
            return new RuleSpec(sourceFilter, targetFilter, selectionMethod, linksPerPage, bidirectional,
                    avoidSelfLinks, position);
        }
    }
}
