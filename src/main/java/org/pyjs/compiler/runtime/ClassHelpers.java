package org.pyjs.compiler.runtime;

/**
 * Calling convention and class model: keyword-argument binding, instantiation, single inheritance
 * with mixins and class-level attribute access.
 */
final class ClassHelpers {

    private ClassHelpers() {
    }

    static void register(RuntimeLibrary.Registry registry) {
        registry.function("_pyfunc_op_def", """
                function _pyfunc_op_def(name, names, defaults, varargs, kwonly, kwargs, fn) {
                    var wrapper = function () {
                        var args = Array.prototype.slice.call(arguments), kw = null, values = [], present = [], extra = {},
                            keywords = {}, missing = [], rest = [], i, key;
                        if (args.length && args[args.length - 1] instanceof _pyfunc_op_kwargs) {
                            kw = args.pop().kwargs;
                        }
                        if (args.length > names.length) {
                            if (!varargs) {
                                throw _pyexc_TypeError(name + "() takes " + names.length + " positional argument"
                                    + (names.length === 1 ? "" : "s") + " but " + args.length + (args.length === 1 ? " was" : " were") + " given");
                            }
                            rest = args.slice(names.length);
                        }
                        for (i = 0; i < names.length; i++) {
                            present.push(i < args.length);
                            values.push(i < args.length ? args[i] : undefined);
                        }
                        if (kw !== null) {
                            for (key in kw) {
                                if (!Object.prototype.hasOwnProperty.call(kw, key)) {
                                    continue;
                                }
                                i = names.indexOf(key);
                                if (i >= 0) {
                                    if (present[i]) {
                                        throw _pyexc_TypeError(name + "() got multiple values for argument '" + key + "'");
                                    }
                                    values[i] = kw[key];
                                    present[i] = true;
                                } else if (kwonly.indexOf(key) >= 0) {
                                    keywords[key] = kw[key];
                                } else if (kwargs) {
                                    extra[key] = kw[key];
                                } else {
                                    throw _pyexc_TypeError(name + "() got an unexpected keyword argument '" + key + "'");
                                }
                            }
                        }
                        for (i = 0; i < names.length; i++) {
                            if (!present[i]) {
                                if (Object.prototype.hasOwnProperty.call(defaults, names[i])) {
                                    values[i] = defaults[names[i]];
                                } else {
                                    missing.push("'" + names[i] + "'");
                                }
                            }
                        }
                        if (missing.length) {
                            throw _pyexc_TypeError(name + "() missing " + missing.length + " required positional argument"
                                + (missing.length === 1 ? "" : "s") + ": " + missing.join(", "));
                        }
                        if (varargs) {
                            values.push(rest);
                        }
                        for (i = 0; i < kwonly.length; i++) {
                            if (Object.prototype.hasOwnProperty.call(keywords, kwonly[i])) {
                                values.push(keywords[kwonly[i]]);
                            } else if (Object.prototype.hasOwnProperty.call(defaults, kwonly[i])) {
                                values.push(defaults[kwonly[i]]);
                            } else {
                                missing.push("'" + kwonly[i] + "'");
                            }
                        }
                        if (missing.length) {
                            throw _pyexc_TypeError(name + "() missing " + missing.length + " required keyword-only argument"
                                + (missing.length === 1 ? "" : "s") + ": " + missing.join(", "));
                        }
                        if (kwargs) {
                            values.push(extra);
                        }
                        return fn.apply(this, values);
                    };
                    wrapper.__name__ = name;
                    return wrapper;
                }
                """);
        registry.function("_pyfunc_op_call", """
                function _pyfunc_op_call(fn, self, args, kwargs) {
                    if (typeof fn !== "function") {
                        throw _pyexc_TypeError("'" + _pyfunc_op_typename(fn) + "' object is not callable");
                    }
                    if (kwargs !== null && kwargs !== undefined) {
                        args = args.concat([new _pyfunc_op_kwargs(kwargs)]);
                    }
                    return fn.apply(self, args);
                }
                """);
        registry.function("_pyfunc_op_callmethod", """
                function _pyfunc_op_callmethod(obj, name, args, kwargs) {
                    return _pyfunc_op_call(_pyfunc_op_method(obj, name), obj, args, kwargs);
                }
                """);
        registry.function("_pyfunc_op_instantiate", """
                function _pyfunc_op_instantiate(cls, self, args) {
                    if (!(self instanceof cls)) {
                        self = Object.create(cls.prototype);
                    }
                    if (typeof self.__init__ === "function") {
                        self.__init__.apply(self, args);
                    }
                    return self;
                }
                """);
        registry.function("_pyfunc_op_ancestry", """
                function _pyfunc_op_ancestry(cls) {
                    var result = [cls], bases = cls.__pybases__ || [], i, j, inherited;
                    for (i = 0; i < bases.length; i++) {
                        inherited = _pyfunc_op_ancestry(bases[i]);
                        for (j = 0; j < inherited.length; j++) {
                            if (result.indexOf(inherited[j]) < 0) {
                                result.push(inherited[j]);
                            }
                        }
                    }
                    return result;
                }
                """);
        registry.function("_pyfunc_op_extends", """
                function _pyfunc_op_extends(cls, base, name, mixins) {
                    var bases, seen = [], ancestry, proto, i, j, key;
                    if (base === null || base === undefined) {
                        base = Object;
                    }
                    bases = [base].concat(mixins);
                    for (i = 0; i < bases.length; i++) {
                        if (typeof bases[i] !== "function") {
                            throw _pyexc_TypeError("class " + name + " cannot inherit from '" + _pyfunc_op_typename(bases[i]) + "' object");
                        }
                        ancestry = bases[i] === Object ? [] : _pyfunc_op_ancestry(bases[i]);
                        for (j = 0; j < ancestry.length; j++) {
                            if (seen.indexOf(ancestry[j]) >= 0) {
                                throw _pyexc_TypeError("class " + name + " inherits " + (ancestry[j].__name__ || ancestry[j].name)
                                    + " along more than one path; diamond inheritance is not supported");
                            }
                            seen.push(ancestry[j]);
                        }
                    }
                    cls.prototype = Object.create(base.prototype);
                    cls.prototype.constructor = cls;
                    cls.__name__ = name;
                    cls.__pybases__ = base === Object ? mixins.slice() : bases;
                    for (i = 0; i < mixins.length; i++) {
                        proto = mixins[i].prototype;
                        for (key in proto) {
                            if (!(key in cls.prototype)) {
                                cls.prototype[key] = proto[key];
                            }
                        }
                    }
                    return cls;
                }
                """);
        registry.function("_pyfunc_op_classattr", """
                function _pyfunc_op_classattr(cls, key) {
                    try {
                        Object.defineProperty(cls, key, {
                            get: function () {
                                var value = cls.prototype[key];
                                if (typeof value === "function" && !value.__pystatic__ && !value.__pybases__) {
                                    return function (self) {
                                        return value.apply(self, Array.prototype.slice.call(arguments, 1));
                                    };
                                }
                                return value;
                            },
                            set: function (value) {
                                cls.prototype[key] = value;
                            },
                            enumerable: true,
                            configurable: true
                        });
                    } catch (err) {
                        // a non-configurable function property keeps its native value; the member stays reachable on instances
                        return false;
                    }
                    return true;
                }
                """);
        registry.function("_pyfunc_op_expose", """
                function _pyfunc_op_expose(cls) {
                    var reserved = ["constructor", "prototype", "length", "name", "caller", "arguments"], key;
                    for (key in cls.prototype) {
                        if (reserved.indexOf(key) < 0 && !Object.prototype.hasOwnProperty.call(cls, key)) {
                            _pyfunc_op_classattr(cls, key);
                        }
                    }
                    return cls;
                }
                """);
        registry.function("_pyfunc_op_staticmethod", """
                function _pyfunc_op_staticmethod(fn) {
                    fn.__pystatic__ = true;
                    return fn;
                }
                """);
        registry.function("_pyfunc_op_supermethod", """
                function _pyfunc_op_supermethod(base, name) {
                    var fn = (base === null || base === undefined ? Object : base).prototype[name];
                    if (typeof fn === "function") {
                        return fn;
                    }
                    if (name === "__init__") {
                        return function () {
                        };
                    }
                    throw _pyexc_AttributeError("'super' object has no attribute '" + name + "'");
                }
                """);
        registry.function("_pyfunc_op_issubclass", """
                function _pyfunc_op_issubclass(cls, target) {
                    var bases, i;
                    if (typeof cls !== "function" || typeof target !== "function") {
                        return false;
                    }
                    if (cls === target || cls.prototype instanceof target) {
                        return true;
                    }
                    bases = cls.__pybases__ || [];
                    for (i = 0; i < bases.length; i++) {
                        if (_pyfunc_op_issubclass(bases[i], target)) {
                            return true;
                        }
                    }
                    return false;
                }
                """);
    }
}
