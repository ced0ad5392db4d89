package org.pyjs.compiler.runtime;

/**
 * Iteration protocol and the iteration builtins. Every iterable is materialized as an array before
 * a loop walks it.
 */
final class IterationHelpers {

    private IterationHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_iter", """
                function _pyfunc_iter(obj) {
                    var result, item, next, hook;
                    if (Array.isArray(obj)) {
                        return obj;
                    }
                    if (typeof obj === "string") {
                        return obj.split("");
                    }
                    if (obj === null || obj === undefined || (typeof obj !== "object" && typeof obj !== "function")) {
                        throw _pyexc_TypeError("'" + _pyfunc_op_typename(obj) + "' object is not iterable");
                    }
                    hook = _pyfunc_op_hook(obj, "__iter__");
                    if (hook) {
                        obj = hook.call(obj);
                        if (Array.isArray(obj)) {
                            return obj;
                        }
                    } else if (_pyfunc_op_isdict(obj)) {
                        return Object.keys(obj);
                    }
                    if (typeof obj.__next__ === "function") {
                        result = [];
                        while (true) {
                            try {
                                item = obj.__next__();
                            } catch (err) {
                                if (_pyfunc_op_matches(err, _pyexc_StopIteration)) {
                                    break;
                                }
                                throw err;
                            }
                            result.push(item);
                        }
                        return result;
                    }
                    if (typeof obj.next === "function") {
                        result = [];
                        for (next = obj.next(); !next.done; next = obj.next()) {
                            result.push(next.value);
                        }
                        return result;
                    }
                    if (typeof Symbol === "function" && typeof obj[Symbol.iterator] === "function") {
                        return _pyfunc_iter(obj[Symbol.iterator]());
                    }
                    throw _pyexc_TypeError("'" + _pyfunc_op_typename(obj) + "' object is not iterable");
                }
                """);
        registry.function("_pyfunc_range", """
                function _pyfunc_range(start, stop, step) {
                    var result = [], i;
                    if (stop === undefined || stop === null) {
                        stop = start;
                        start = 0;
                    }
                    if (step === undefined || step === null) {
                        step = 1;
                    }
                    if (step === 0) {
                        throw _pyexc_ValueError("range() arg 3 must not be zero");
                    }
                    if (step > 0) {
                        for (i = start; i < stop; i += step) {
                            result.push(i);
                        }
                    } else {
                        for (i = start; i > stop; i += step) {
                            result.push(i);
                        }
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_len", """
                function _pyfunc_len(obj) {
                    var hook;
                    if (typeof obj === "string" || Array.isArray(obj)) {
                        return obj.length;
                    }
                    hook = _pyfunc_op_hook(obj, "__len__");
                    if (hook) {
                        return hook.call(obj);
                    }
                    if (_pyfunc_op_isdict(obj)) {
                        return Object.keys(obj).length;
                    }
                    throw _pyexc_TypeError("object of type '" + _pyfunc_op_typename(obj) + "' has no len()");
                }
                """);
        registry.function("_pyfunc_enumerate", """
                function _pyfunc_enumerate() {
                    var args = _pyfunc_op_popkw(arguments), items = _pyfunc_iter(args[0][0]), result = [], start, i;
                    start = args[0].length > 1 ? args[0][1] : (args[1].start !== undefined ? args[1].start : 0);
                    for (i = 0; i < items.length; i++) {
                        result.push([start + i, items[i]]);
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_zip", """
                function _pyfunc_zip() {
                    var lists = [], result = [], n = Infinity, i, j, row;
                    if (!arguments.length) {
                        return [];
                    }
                    for (i = 0; i < arguments.length; i++) {
                        lists.push(_pyfunc_iter(arguments[i]));
                        n = Math.min(n, lists[i].length);
                    }
                    for (j = 0; j < n; j++) {
                        row = [];
                        for (i = 0; i < lists.length; i++) {
                            row.push(lists[i][j]);
                        }
                        result.push(row);
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_reversed", """
                function _pyfunc_reversed(seq) {
                    return _pyfunc_iter(seq).slice().reverse();
                }
                """);
        registry.function("_pyfunc_op_sort", """
                function _pyfunc_op_sort(items, key, reverse) {
                    var decorated = [], i;
                    for (i = 0; i < items.length; i++) {
                        decorated.push([key ? key(items[i]) : items[i], i, items[i]]);
                    }
                    decorated.sort(function (x, y) {
                        if (_pyfunc_op_lt(x[0], y[0])) {
                            return reverse ? 1 : -1;
                        }
                        if (_pyfunc_op_lt(y[0], x[0])) {
                            return reverse ? -1 : 1;
                        }
                        return x[1] - y[1];
                    });
                    for (i = 0; i < items.length; i++) {
                        items[i] = decorated[i][2];
                    }
                    return items;
                }
                """);
        registry.function("_pyfunc_sorted", """
                function _pyfunc_sorted() {
                    var args = _pyfunc_op_popkw(arguments);
                    return _pyfunc_op_sort(_pyfunc_iter(args[0][0]).slice(), args[1].key, _pyfunc_truthy(args[1].reverse));
                }
                """);
        registry.function("_pyfunc_map", """
                function _pyfunc_map(fn) {
                    var lists = [], result = [], n = Infinity, i, j, row;
                    for (i = 1; i < arguments.length; i++) {
                        lists.push(_pyfunc_iter(arguments[i]));
                        n = Math.min(n, lists[lists.length - 1].length);
                    }
                    for (j = 0; j < n; j++) {
                        row = [];
                        for (i = 0; i < lists.length; i++) {
                            row.push(lists[i][j]);
                        }
                        result.push(fn.apply(null, row));
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_filter", """
                function _pyfunc_filter(fn, iterable) {
                    var items = _pyfunc_iter(iterable), result = [], i;
                    for (i = 0; i < items.length; i++) {
                        if (_pyfunc_truthy(fn === null || fn === undefined ? items[i] : fn(items[i]))) {
                            result.push(items[i]);
                        }
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_any", """
                function _pyfunc_any(iterable) {
                    var items = _pyfunc_iter(iterable), i;
                    for (i = 0; i < items.length; i++) {
                        if (_pyfunc_truthy(items[i])) {
                            return true;
                        }
                    }
                    return false;
                }
                """);
        registry.function("_pyfunc_all", """
                function _pyfunc_all(iterable) {
                    var items = _pyfunc_iter(iterable), i;
                    for (i = 0; i < items.length; i++) {
                        if (!_pyfunc_truthy(items[i])) {
                            return false;
                        }
                    }
                    return true;
                }
                """);
        registry.function("_pyfunc_sum", """
                function _pyfunc_sum(iterable, start) {
                    var items = _pyfunc_iter(iterable), total = start === undefined ? 0 : start, i;
                    for (i = 0; i < items.length; i++) {
                        total = _pyfunc_op_add(total, items[i]);
                    }
                    return total;
                }
                """);
        registry.function("_pyfunc_op_extreme", """
                function _pyfunc_op_extreme(rawArgs, greatest, name) {
                    var args = _pyfunc_op_popkw(rawArgs), items, key = args[1].key, best, bestKey, candidate, i;
                    items = args[0].length === 1 ? _pyfunc_iter(args[0][0]) : args[0];
                    if (!items.length) {
                        if (Object.prototype.hasOwnProperty.call(args[1], "default")) {
                            return args[1]["default"];
                        }
                        throw _pyexc_ValueError(name + "() arg is an empty sequence");
                    }
                    best = items[0];
                    bestKey = key ? key(best) : best;
                    for (i = 1; i < items.length; i++) {
                        candidate = key ? key(items[i]) : items[i];
                        if (greatest ? _pyfunc_op_lt(bestKey, candidate) : _pyfunc_op_lt(candidate, bestKey)) {
                            best = items[i];
                            bestKey = candidate;
                        }
                    }
                    return best;
                }
                """);
        registry.function("_pyfunc_min", """
                function _pyfunc_min() {
                    return _pyfunc_op_extreme(arguments, false, "min");
                }
                """);
        registry.function("_pyfunc_max", """
                function _pyfunc_max() {
                    return _pyfunc_op_extreme(arguments, true, "max");
                }
                """);
        registry.function("_pyfunc_unpack", """
                function _pyfunc_unpack(value, n) {
                    var items = _pyfunc_iter(value);
                    if (items.length < n) {
                        throw _pyexc_ValueError("not enough values to unpack (expected " + n + ", got " + items.length + ")");
                    }
                    if (items.length > n) {
                        throw _pyexc_ValueError("too many values to unpack (expected " + n + ")");
                    }
                    return items;
                }
                """);
        registry.function("_pyfunc_unpack_star", """
                function _pyfunc_unpack_star(value, before, after) {
                    var items = _pyfunc_iter(value);
                    if (items.length < before + after) {
                        throw _pyexc_ValueError("not enough values to unpack (expected at least " + (before + after) + ", got " + items.length + ")");
                    }
                    return items.slice(0, before).concat([items.slice(before, items.length - after)], items.slice(items.length - after));
                }
                """);
    }
}
