package org.pyjs.compiler.runtime;

/**
 * Methods of the builtin container and string types. Each helper is invoked with the receiver as
 * {@code this} and falls back to the receiver's own method of the same name when the receiver is
 * not a builtin value.
 */
final class MethodHelpers {

    private MethodHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pymeth_append", """
                function _pymeth_append(x) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "append").apply(self, arguments);
                    }
                    self.push(x);
                    return null;
                }
                """);
        registry.function("_pymeth_extend", """
                function _pymeth_extend(iterable) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "extend").apply(self, arguments);
                    }
                    self.push.apply(self, _pyfunc_iter(iterable));
                    return null;
                }
                """);
        registry.function("_pymeth_insert", """
                function _pymeth_insert(index, x) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "insert").apply(self, arguments);
                    }
                    if (index < 0) {
                        index = Math.max(0, index + self.length);
                    }
                    self.splice(Math.min(index, self.length), 0, x);
                    return null;
                }
                """);
        registry.function("_pymeth_remove", """
                function _pymeth_remove(x) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "remove").apply(self, arguments);
                    }
                    var i;
                    for (i = 0; i < self.length; i++) {
                        if (_pyfunc_op_equals(self[i], x)) {
                            self.splice(i, 1);
                            return null;
                        }
                    }
                    throw _pyexc_ValueError("list.remove(x): x not in list");
                }
                """);
        registry.function("_pymeth_pop", """
                function _pymeth_pop(key, fallback) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self) || _pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "pop").apply(self, arguments);
                    }
                    var value;
                    if (Array.isArray(self)) {
                        if (!self.length) {
                            throw _pyexc_IndexError("pop from empty list");
                        }
                        return self.splice(_pyfunc_op_index(self, key === undefined ? -1 : key), 1)[0];
                    }
                    if (!Object.prototype.hasOwnProperty.call(self, key)) {
                        if (arguments.length > 1) {
                            return fallback;
                        }
                        throw _pyexc_KeyError(key);
                    }
                    value = self[key];
                    delete self[key];
                    return value;
                }
                """);
        registry.function("_pymeth_index", """
                function _pymeth_index(x) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self) || typeof self === "string")) {
                        return _pyfunc_op_method(self, "index").apply(self, arguments);
                    }
                    var i;
                    if (typeof self === "string") {
                        i = self.indexOf(x);
                        if (i < 0) {
                            throw _pyexc_ValueError("substring not found");
                        }
                        return i;
                    }
                    for (i = 0; i < self.length; i++) {
                        if (_pyfunc_op_equals(self[i], x)) {
                            return i;
                        }
                    }
                    throw _pyexc_ValueError(_pyfunc_repr(x) + " is not in list");
                }
                """);
        registry.function("_pymeth_count", """
                function _pymeth_count(x) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self) || typeof self === "string")) {
                        return _pyfunc_op_method(self, "count").apply(self, arguments);
                    }
                    var n = 0, i;
                    if (typeof self === "string") {
                        return x === "" ? self.length + 1 : self.split(x).length - 1;
                    }
                    for (i = 0; i < self.length; i++) {
                        if (_pyfunc_op_equals(self[i], x)) {
                            n++;
                        }
                    }
                    return n;
                }
                """);
        registry.function("_pymeth_sort", """
                function _pymeth_sort() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "sort").apply(self, arguments);
                    }
                    var args = _pyfunc_op_popkw(arguments);
                    _pyfunc_op_sort(self, args[1].key, _pyfunc_truthy(args[1].reverse));
                    return null;
                }
                """);
        registry.function("_pymeth_reverse", """
                function _pymeth_reverse() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "reverse").apply(self, arguments);
                    }
                    self.reverse();
                    return null;
                }
                """);
        registry.function("_pymeth_copy", """
                function _pymeth_copy() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self) || _pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "copy").apply(self, arguments);
                    }
                    return Array.isArray(self) ? self.slice() : _pyfunc_dict(self);
                }
                """);
        registry.function("_pymeth_clear", """
                function _pymeth_clear() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self) || _pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "clear").apply(self, arguments);
                    }
                    var keys, i;
                    if (Array.isArray(self)) {
                        self.length = 0;
                        return null;
                    }
                    keys = Object.keys(self);
                    for (i = 0; i < keys.length; i++) {
                        delete self[keys[i]];
                    }
                    return null;
                }
                """);
        registry.function("_pymeth_keys", """
                function _pymeth_keys() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(_pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "keys").apply(self, arguments);
                    }
                    return Object.keys(self);
                }
                """);
        registry.function("_pymeth_values", """
                function _pymeth_values() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(_pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "values").apply(self, arguments);
                    }
                    var keys = Object.keys(self), result = [], i;
                    for (i = 0; i < keys.length; i++) {
                        result.push(self[keys[i]]);
                    }
                    return result;
                }
                """);
        registry.function("_pymeth_items", """
                function _pymeth_items() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(_pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "items").apply(self, arguments);
                    }
                    var keys = Object.keys(self), result = [], i;
                    for (i = 0; i < keys.length; i++) {
                        result.push([keys[i], self[keys[i]]]);
                    }
                    return result;
                }
                """);
        registry.function("_pymeth_get", """
                function _pymeth_get(key, fallback) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(_pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "get").apply(self, arguments);
                    }
                    if (Object.prototype.hasOwnProperty.call(self, key)) {
                        return self[key];
                    }
                    return fallback === undefined ? null : fallback;
                }
                """);
        registry.function("_pymeth_setdefault", """
                function _pymeth_setdefault(key, fallback) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(_pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "setdefault").apply(self, arguments);
                    }
                    if (!Object.prototype.hasOwnProperty.call(self, key)) {
                        self[key] = fallback === undefined ? null : fallback;
                    }
                    return self[key];
                }
                """);
        registry.function("_pymeth_update", """
                function _pymeth_update() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(_pyfunc_op_isdict(self))) {
                        return _pyfunc_op_method(self, "update").apply(self, arguments);
                    }
                    var source = _pyfunc_dict.apply(null, arguments), key;
                    for (key in source) {
                        if (Object.prototype.hasOwnProperty.call(source, key)) {
                            self[key] = source[key];
                        }
                    }
                    return null;
                }
                """);
        registry.function("_pymeth_add", """
                function _pymeth_add(x) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "add").apply(self, arguments);
                    }
                    if (!_pyfunc_op_contains(self, x)) {
                        self.push(x);
                    }
                    return null;
                }
                """);
        registry.function("_pymeth_discard", """
                function _pymeth_discard(x) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(Array.isArray(self))) {
                        return _pyfunc_op_method(self, "discard").apply(self, arguments);
                    }
                    var i;
                    for (i = 0; i < self.length; i++) {
                        if (_pyfunc_op_equals(self[i], x)) {
                            self.splice(i, 1);
                            break;
                        }
                    }
                    return null;
                }
                """);
        registry.function("_pymeth_join", """
                function _pymeth_join(iterable) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "join").apply(self, arguments);
                    }
                    var items = _pyfunc_iter(iterable), i;
                    for (i = 0; i < items.length; i++) {
                        if (typeof items[i] !== "string") {
                            throw _pyexc_TypeError("sequence item " + i + ": expected str instance, " + _pyfunc_op_typename(items[i]) + " found");
                        }
                    }
                    return items.join(self);
                }
                """);
        registry.function("_pymeth_split", """
                function _pymeth_split(sep, maxsplit) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "split").apply(self, arguments);
                    }
                    var parts, limit = maxsplit === undefined || maxsplit === null ? -1 : maxsplit, rest;
                    if (sep === undefined || sep === null) {
                        rest = self.replace(/^\\s+/, "");
                        parts = [];
                        while (rest.length && (limit < 0 || parts.length < limit)) {
                            parts.push(rest.match(/^\\S*/)[0]);
                            rest = rest.replace(/^\\S*\\s*/, "");
                        }
                        if (rest.length) {
                            parts.push(rest.replace(/\\s+$/, ""));
                        }
                        return parts;
                    }
                    if (sep === "") {
                        throw _pyexc_ValueError("empty separator");
                    }
                    parts = self.split(sep);
                    if (limit >= 0 && parts.length > limit + 1) {
                        parts = parts.slice(0, limit).concat([parts.slice(limit).join(sep)]);
                    }
                    return parts;
                }
                """);
        registry.function("_pymeth_strip", """
                function _pymeth_strip(chars) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "strip").apply(self, arguments);
                    }
                    return _pymeth_rstrip.call(_pymeth_lstrip.call(self, chars), chars);
                }
                """);
        registry.function("_pymeth_lstrip", """
                function _pymeth_lstrip(chars) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "lstrip").apply(self, arguments);
                    }
                    var i = 0;
                    if (chars === undefined || chars === null) {
                        return self.replace(/^\\s+/, "");
                    }
                    while (i < self.length && chars.indexOf(self.charAt(i)) >= 0) {
                        i++;
                    }
                    return self.substring(i);
                }
                """);
        registry.function("_pymeth_rstrip", """
                function _pymeth_rstrip(chars) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "rstrip").apply(self, arguments);
                    }
                    var i = self.length;
                    if (chars === undefined || chars === null) {
                        return self.replace(/\\s+$/, "");
                    }
                    while (i > 0 && chars.indexOf(self.charAt(i - 1)) >= 0) {
                        i--;
                    }
                    return self.substring(0, i);
                }
                """);
        registry.function("_pymeth_upper", """
                function _pymeth_upper() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "upper").apply(self, arguments);
                    }
                    return self.toUpperCase();
                }
                """);
        registry.function("_pymeth_lower", """
                function _pymeth_lower() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "lower").apply(self, arguments);
                    }
                    return self.toLowerCase();
                }
                """);
        registry.function("_pymeth_startswith", """
                function _pymeth_startswith(prefix) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "startswith").apply(self, arguments);
                    }
                    var candidates = Array.isArray(prefix) ? prefix : [prefix], i;
                    for (i = 0; i < candidates.length; i++) {
                        if (self.substring(0, candidates[i].length) === candidates[i]) {
                            return true;
                        }
                    }
                    return false;
                }
                """);
        registry.function("_pymeth_endswith", """
                function _pymeth_endswith(suffix) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "endswith").apply(self, arguments);
                    }
                    var candidates = Array.isArray(suffix) ? suffix : [suffix], i;
                    for (i = 0; i < candidates.length; i++) {
                        if (self.length >= candidates[i].length && self.substring(self.length - candidates[i].length) === candidates[i]) {
                            return true;
                        }
                    }
                    return false;
                }
                """);
        registry.function("_pymeth_replace", """
                function _pymeth_replace(old, replacement, count) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "replace").apply(self, arguments);
                    }
                    var parts = self.split(old);
                    if (count === undefined || count === null || count < 0 || parts.length - 1 <= count) {
                        return parts.join(replacement);
                    }
                    return parts.slice(0, count + 1).join(replacement) + old + parts.slice(count + 1).join(old);
                }
                """);
        registry.function("_pymeth_find", """
                function _pymeth_find(sub) {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "find").apply(self, arguments);
                    }
                    return self.indexOf(sub);
                }
                """);
        registry.function("_pymeth_isdigit", """
                function _pymeth_isdigit() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "isdigit").apply(self, arguments);
                    }
                    return /^[0-9]+$/.test(self);
                }
                """);
        registry.function("_pymeth_isalpha", """
                function _pymeth_isalpha() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "isalpha").apply(self, arguments);
                    }
                    return /^[A-Za-z]+$/.test(self);
                }
                """);
        registry.function("_pymeth_format", """
                function _pymeth_format() {
                    var self = _pyfunc_op_unbox(this);
                    if (!(typeof self === "string")) {
                        return _pyfunc_op_method(self, "format").apply(self, arguments);
                    }
                    var args = _pyfunc_op_popkw(arguments), positional = args[0], kwargs = args[1], auto = 0;
                    return self.replace(/\\{\\{|\\}\\}|\\{([^{}!:]*)(?:!([rsa]))?(?::([^{}]*))?\\}/g, function (match, field, conversion, spec) {
                        var parts, value, i;
                        if (match === "{{") {
                            return "{";
                        }
                        if (match === "}}") {
                            return "}";
                        }
                        parts = (field || "").split(".");
                        if (parts[0] === "") {
                            i = auto++;
                        } else if (/^\\d+$/.test(parts[0])) {
                            i = +parts[0];
                        } else {
                            if (!Object.prototype.hasOwnProperty.call(kwargs, parts[0])) {
                                throw _pyexc_KeyError(parts[0]);
                            }
                            i = -1;
                            value = kwargs[parts[0]];
                        }
                        if (i >= 0) {
                            if (i >= positional.length) {
                                throw _pyexc_IndexError("Replacement index " + i + " out of range for positional args tuple");
                            }
                            value = positional[i];
                        }
                        for (i = 1; i < parts.length; i++) {
                            value = value[parts[i]];
                        }
                        if (conversion === "r" || conversion === "a") {
                            value = _pyfunc_repr(value);
                        } else if (conversion === "s") {
                            value = _pyfunc_str(value);
                        }
                        return _pyfunc_format(value, spec || "");
                    });
                }
                """);
    }
}
