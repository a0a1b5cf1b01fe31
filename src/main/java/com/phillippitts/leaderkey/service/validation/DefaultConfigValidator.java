package com.phillippitts.leaderkey.service.validation;

import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.domain.ValidationError;
import com.phillippitts.leaderkey.domain.ValidationErrorType;
import com.phillippitts.leaderkey.service.keys.KeyMatcher;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Default rules: every non-root node needs a key, a key is one character or a known
 * special key, sibling keys are unique, and actions carry a value.
 *
 * <p>Walks the tree with an explicit stack so very deep trees cannot overflow the call stack.
 * Errors come out in depth-first pre-order; a duplicate is reported on every sibling after
 * the first one using that key.
 */
@Component
public class DefaultConfigValidator implements ConfigValidator {

    private record Frame(Node node, List<Integer> path, List<ValidationErrorType> errors) { }

    @Override
    public List<ValidationError> validate(Group root) {
        List<ValidationError> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, List.of(), List.of()));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            for (ValidationErrorType type : frame.errors()) {
                result.add(new ValidationError(frame.path(), type));
            }
            if (frame.node() instanceof Group group) {
                List<Frame> children = childFrames(group, frame.path());
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return result;
    }

    private static List<Frame> childFrames(Group group, List<Integer> parentPath) {
        List<Frame> frames = new ArrayList<>(group.children().size());
        Set<String> seenKeys = new HashSet<>();
        for (int i = 0; i < group.children().size(); i++) {
            Node child = group.children().get(i);
            List<ValidationErrorType> errors = new ArrayList<>(2);
            String key = child.key();
            if (key == null || key.isBlank()) {
                errors.add(ValidationErrorType.EMPTY_KEY);
            } else {
                if (!KeyMatcher.isValidKey(key)) {
                    errors.add(ValidationErrorType.NON_SINGLE_CHARACTER_KEY);
                }
                if (!seenKeys.add(KeyMatcher.normalize(key))) {
                    errors.add(ValidationErrorType.DUPLICATE_KEY);
                }
            }
            if (child instanceof Action action && action.value().isBlank()) {
                errors.add(ValidationErrorType.EMPTY_VALUE);
            }
            List<Integer> path = new ArrayList<>(parentPath.size() + 1);
            path.addAll(parentPath);
            path.add(i);
            frames.add(new Frame(child, List.copyOf(path), errors));
        }
        return frames;
    }
}
