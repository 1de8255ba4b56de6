package com.kge.completion;

/**
 * zsh integration, enabled with {@code source <(kge --completion zsh)}.
 */
public final class ZshCompletionScript {

    public static final String SCRIPT = """
            _kge() {
                local -a pods
                local -a namespaces
                namespaces=($(kge --complete-ns))

                _arguments \\
                    '(-n --namespace)'{-n,--namespace}'[Specify namespace to use]:namespace:->namespaces' \\
                    '(-e --exceptions-only)'{-e,--exceptions-only}'[Show only non-normal events]' \\
                    '(-a --all)'{-a,--all}'[Get events for all pods]' \\
                    '(-r --reason)'{-r,--reason}'[Only events with this reason]:reason:' \\
                    '(-k --kind)'{-k,--kind}'[Only events for this object kind]:kind:' \\
                    '(-t --type)'{-t,--type}'[Only events of this type]:type:(Normal Warning)' \\
                    '(-o --output)'{-o,--output}'[Output format]:format:(text json)' \\
                    '--show-timestamps[Show absolute timestamps]' \\
                    '(-v --version)'{-v,--version}'[Show version information]' \\
                    '*:pod:->pods'

                case $state in
                    namespaces)
                        _describe 'namespaces' namespaces
                        ;;
                    pods)
                        local namespace
                        for ((i=1; i < ${#words}; i++)); do
                            if [[ ${words[i]} == "-n" || ${words[i]} == "--namespace" ]]; then
                                namespace=${words[i+1]}
                                break
                            fi
                        done
                        if [[ -n $namespace ]]; then
                            pods=($(kge --complete-pod -n $namespace))
                        else
                            pods=($(kge --complete-pod))
                        fi
                        _describe 'pods' pods
                        ;;
                esac
            }
            compdef _kge kge
            """;

    private ZshCompletionScript() {
    }
}
